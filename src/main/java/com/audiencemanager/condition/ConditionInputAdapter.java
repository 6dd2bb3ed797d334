package com.audiencemanager.condition;

import com.audiencemanager.domain.model.Condition;
import com.audiencemanager.exception.BusinessException;
import com.audiencemanager.exception.ErrorCode;
import com.audiencemanager.mapper.JsonHelper;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Normalizes rule conditions received from clients or old catalog rows into the
 * canonical {@link Condition} list the compiler and resolver work on.
 *
 * <p>Two input shapes are accepted:
 * <ul>
 *   <li><b>list</b> -- {@code [{"field": "amount", "operator": ">", "value": 1000}, ...]}.
 *       The aliases {@code start_date}, {@code end_date} and {@code min_transactions}
 *       are rewritten to {@code transaction_date >=}, {@code transaction_date <=} and
 *       {@code transaction_count >=}.</li>
 *   <li><b>legacy dictionary</b> -- a flat object such as
 *       {@code {"start_date": "2024-01-01", "city_tier": 1, "amount": 500,
 *       "amount_operator": ">"}}. Every recognised key becomes one condition; unknown
 *       keys are ignored with a warning.</li>
 * </ul>
 * A JSON string holding either shape is parsed first. Field and operator validation is
 * left to {@link ConditionCompiler}, which reports what it cannot use.
 */
@Component
public class ConditionInputAdapter {

    private static final Logger log = LoggerFactory.getLogger(ConditionInputAdapter.class);

    private static final String TRANSACTION_DATE = "transaction_date";
    private static final String TRANSACTION_COUNT = "transaction_count";

    /** Keys of the legacy dictionary, in the order their conditions are emitted. */
    private static final List<String> LEGACY_KEYS = List.of(
            "start_date",
            "end_date",
            "timeframe_days",
            "city_tier",
            "city_tier_in",
            "transaction_type",
            "amount",
            "amount_operator",
            "type",
            "value",
            "operator",
            "total_spend_gt",
            "total_spend_lt",
            "transaction_count_gt",
            "transaction_count_lt",
            "min_transactions");

    public List<Condition> normalize(Object raw) {
        return normalize(raw, LocalDate.now());
    }

    /**
     * Normalizes {@code raw}, resolving relative legacy timeframes against {@code today}.
     *
     * @throws BusinessException with {@code VALIDATION_ERROR} when the input is neither a
     *     list nor an object, or is a string that is not valid JSON
     */
    public List<Condition> normalize(Object raw, LocalDate today) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof String json) {
            return normalize(parseJson(json), today);
        }
        if (raw instanceof Collection<?> items) {
            return fromList(items);
        }
        if (raw instanceof Map<?, ?> map) {
            return fromLegacyDictionary(map, today);
        }
        throw new BusinessException(
                ErrorCode.VALIDATION_ERROR,
                "Conditions must be a list or an object, got " + raw.getClass().getSimpleName());
    }

    // ---- List format ----

    private List<Condition> fromList(Collection<?> items) {
        List<Condition> conditions = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof Condition condition) {
                conditions.add(applyAlias(condition));
            } else if (item instanceof Map<?, ?> map) {
                Condition condition = Condition.builder()
                        .field(asString(map.get("field")))
                        .operator(asString(map.get("operator")))
                        .value(map.get("value"))
                        .value2(map.get("value2"))
                        .build();
                conditions.add(applyAlias(condition));
            } else {
                // Kept so the compiler reports it as a dropped condition at its position.
                log.warn("Condition entry is not an object: {}", item);
                conditions.add(new Condition());
            }
        }
        return List.copyOf(conditions);
    }

    private Condition applyAlias(Condition condition) {
        String field = condition.getField();
        if (field == null) {
            return condition;
        }
        return switch (field.trim().toLowerCase(Locale.ROOT)) {
            case "start_date" -> aliased(condition, TRANSACTION_DATE, ">=");
            case "end_date" -> aliased(condition, TRANSACTION_DATE, "<=");
            case "min_transactions" -> aliased(condition, TRANSACTION_COUNT, ">=");
            default -> condition;
        };
    }

    private static Condition aliased(Condition condition, String field, String operator) {
        return Condition.builder()
                .field(field)
                .operator(operator)
                .value(condition.getValue())
                .value2(condition.getValue2())
                .build();
    }

    // ---- Legacy dictionary format ----

    private List<Condition> fromLegacyDictionary(Map<?, ?> raw, LocalDate today) {
        Map<?, ?> dict = raw;
        for (Object key : dict.keySet()) {
            if (!LEGACY_KEYS.contains(String.valueOf(key))) {
                log.warn("Ignoring unknown legacy condition key '{}'", key);
            }
        }

        List<Condition> conditions = new ArrayList<>();
        if (isPresent(dict.get("start_date"))) {
            conditions.add(Condition.of(TRANSACTION_DATE, ">=", dict.get("start_date")));
        }
        if (isPresent(dict.get("end_date"))) {
            conditions.add(Condition.of(TRANSACTION_DATE, "<=", dict.get("end_date")));
        }
        if (isPresent(dict.get("timeframe_days"))) {
            conditions.add(timeframe(dict.get("timeframe_days"), today));
        }
        if (isPresent(dict.get("city_tier"))) {
            conditions.add(Condition.of("city_tier", "=", dict.get("city_tier")));
        }
        if (dict.get("city_tier_in") instanceof Collection<?> tiers && !tiers.isEmpty()) {
            conditions.add(Condition.of("city_tier", "IN", List.copyOf(tiers)));
        }
        Object transactionType = dict.get("transaction_type");
        if (isPresent(transactionType) && !"all".equalsIgnoreCase(String.valueOf(transactionType))) {
            conditions.add(Condition.of(
                    "transaction_type", "=", String.valueOf(transactionType).toUpperCase(Locale.ROOT)));
        }
        if (dict.get("amount") != null) {
            Object operator = dict.get("amount_operator");
            conditions.add(Condition.of("amount", operator != null ? String.valueOf(operator) : "=", dict.get("amount")));
        }
        if ("transaction_amount".equals(dict.get("type")) && dict.get("value") != null && dict.get("operator") != null) {
            conditions.add(Condition.of("amount", String.valueOf(dict.get("operator")), dict.get("value")));
        }
        if (dict.get("total_spend_gt") != null) {
            conditions.add(Condition.of("total_spend", ">", dict.get("total_spend_gt")));
        }
        if (dict.get("total_spend_lt") != null) {
            conditions.add(Condition.of("total_spend", "<", dict.get("total_spend_lt")));
        }
        if (dict.get("transaction_count_gt") != null) {
            conditions.add(Condition.of(TRANSACTION_COUNT, ">", dict.get("transaction_count_gt")));
        }
        if (dict.get("transaction_count_lt") != null) {
            conditions.add(Condition.of(TRANSACTION_COUNT, "<", dict.get("transaction_count_lt")));
        }
        if (isPresent(dict.get("min_transactions"))) {
            conditions.add(Condition.of(TRANSACTION_COUNT, ">=", dict.get("min_transactions")));
        }
        log.debug("Translated legacy conditions {} into {}", dict, conditions);
        return List.copyOf(conditions);
    }

    private Condition timeframe(Object days, LocalDate today) {
        try {
            long value = Long.parseLong(String.valueOf(days).trim());
            return Condition.of(TRANSACTION_DATE, ">=", today.minusDays(value).toString());
        } catch (NumberFormatException e) {
            // Left for the compiler to reject as an invalid date.
            log.warn("Legacy timeframe_days '{}' is not a whole number", days);
            return Condition.of(TRANSACTION_DATE, ">=", days);
        }
    }

    private Object parseJson(String json) {
        if (json.isBlank()) {
            return null;
        }
        try {
            return JsonHelper.parseUntyped(json);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Conditions are not valid JSON: " + json);
        }
    }

    private static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String text) {
            return !text.isBlank();
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        return !(value instanceof Boolean bool) || bool;
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
