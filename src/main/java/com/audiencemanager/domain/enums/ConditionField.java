package com.audiencemanager.domain.enums;

import static com.audiencemanager.domain.enums.ConditionOperator.BETWEEN;
import static com.audiencemanager.domain.enums.ConditionOperator.EQ;
import static com.audiencemanager.domain.enums.ConditionOperator.GT;
import static com.audiencemanager.domain.enums.ConditionOperator.GTE;
import static com.audiencemanager.domain.enums.ConditionOperator.IN;
import static com.audiencemanager.domain.enums.ConditionOperator.LT;
import static com.audiencemanager.domain.enums.ConditionOperator.LTE;
import static com.audiencemanager.domain.enums.ConditionOperator.NEQ;
import static com.audiencemanager.domain.enums.ConditionOperator.NOT_IN;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;

/**
 * Allow-list of fields a rule condition may reference.
 *
 * <p>Each field knows its SQL expression, whether it filters raw transactions (WHERE)
 * or aggregated per-user metrics (HAVING), the literal type of its values and the
 * operators it accepts. Anything outside this list is rejected by the compiler.
 */
@Getter
public enum ConditionField {
    AMOUNT("amount", "amount", FieldKind.PRE_AGGREGATION, ValueType.NUMBER, EnumSet.allOf(ConditionOperator.class)),
    CITY_TIER(
            "city_tier", "city_tier", FieldKind.PRE_AGGREGATION, ValueType.NUMBER, EnumSet.allOf(ConditionOperator.class)),
    TRANSACTION_DATE(
            "transaction_date",
            "transaction_date",
            FieldKind.PRE_AGGREGATION,
            ValueType.DATE,
            EnumSet.of(GT, LT, EQ, GTE, LTE, NEQ, BETWEEN)),
    TRANSACTION_TYPE(
            "transaction_type", "source_type", FieldKind.PRE_AGGREGATION, ValueType.TEXT, EnumSet.of(EQ, NEQ, IN, NOT_IN)),
    CATEGORY("category", "category", FieldKind.PRE_AGGREGATION, ValueType.TEXT, EnumSet.of(EQ, NEQ, IN, NOT_IN)),
    TOTAL_SPEND(
            "total_spend",
            "SUM(amount)",
            FieldKind.POST_AGGREGATION,
            ValueType.NUMBER,
            EnumSet.of(GT, LT, EQ, GTE, LTE, NEQ, BETWEEN)),
    TRANSACTION_COUNT(
            "transaction_count",
            "COUNT(*)",
            FieldKind.POST_AGGREGATION,
            ValueType.NUMBER,
            EnumSet.of(GT, LT, EQ, GTE, LTE, NEQ, BETWEEN));

    private final String key;
    private final String sqlExpression;
    private final FieldKind kind;
    private final ValueType valueType;
    private final Set<ConditionOperator> allowedOperators;

    ConditionField(
            String key,
            String sqlExpression,
            FieldKind kind,
            ValueType valueType,
            Set<ConditionOperator> allowedOperators) {
        this.key = key;
        this.sqlExpression = sqlExpression;
        this.kind = kind;
        this.valueType = valueType;
        this.allowedOperators = allowedOperators;
    }

    public boolean allows(ConditionOperator operator) {
        return allowedOperators.contains(operator);
    }

    public static Optional<ConditionField> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(f -> f.key.equals(normalized)).findFirst();
    }
}
