package com.audiencemanager.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single filter predicate of a rule, in canonical form.
 *
 * <p>Field and operator are kept as the strings the user supplied so that malformed
 * conditions survive ingestion and can be reported by the compiler instead of being
 * lost at the API boundary. {@code value} is a scalar or, for IN / NOT IN, a list;
 * {@code value2} is the upper bound of BETWEEN.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Condition {

    private String field;
    private String operator;
    private Object value;
    private Object value2;

    public static Condition of(String field, String operator, Object value) {
        return new Condition(field, operator, value, null);
    }

    public static Condition between(String field, Object low, Object high) {
        return new Condition(field, "BETWEEN", low, high);
    }
}
