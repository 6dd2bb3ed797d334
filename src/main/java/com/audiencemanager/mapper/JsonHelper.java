package com.audiencemanager.mapper;

import com.audiencemanager.domain.model.Condition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON codec for the catalog's text columns.
 *
 * <p>{@code rules.conditions}, {@code rules.declared_conditions} hold condition arrays;
 * {@code rules.dependencies} and {@code segment_catalog.depends_on} hold rule id arrays.
 * An absent id list is stored as SQL NULL so base rules stay distinguishable from
 * composite ones.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().findAndRegisterModules();

    private static final TypeReference<List<Condition>> CONDITION_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Long>> ID_LIST = new TypeReference<>() {};

    private JsonHelper() {}

    public static String writeConditions(List<Condition> conditions) {
        return conditions == null ? null : write(conditions);
    }

    public static List<Condition> readConditions(String column) {
        return read(column, CONDITION_LIST);
    }

    /** Empty and null lists both map to NULL. */
    public static String writeRuleIds(List<Long> ruleIds) {
        return ruleIds == null || ruleIds.isEmpty() ? null : write(ruleIds);
    }

    public static List<Long> readRuleIds(String column) {
        return read(column, ID_LIST);
    }

    /**
     * Parses request-supplied JSON into plain maps, lists and scalars.
     *
     * @throws IllegalArgumentException when the text is not JSON
     */
    public static Object parseUntyped(String json) {
        try {
            return OBJECT_MAPPER.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String write(Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode catalog column from " + value.getClass().getSimpleName(), e);
        }
    }

    private static <T> T read(String column, TypeReference<T> type) {
        if (column == null || column.isBlank()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(column, type);
        } catch (JsonProcessingException e) {
            log.error("Corrupt catalog column, expected {}: {}", type.getType(), column, e);
            throw new IllegalStateException("Could not decode catalog column as " + type.getType(), e);
        }
    }
}
