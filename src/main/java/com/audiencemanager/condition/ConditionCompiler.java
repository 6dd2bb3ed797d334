package com.audiencemanager.condition;

import com.audiencemanager.config.WarehouseConfig;
import com.audiencemanager.config.WarehouseConfig.TransactionSource;
import com.audiencemanager.domain.enums.CompileWarningReason;
import com.audiencemanager.domain.enums.ConditionField;
import com.audiencemanager.domain.enums.ConditionOperator;
import com.audiencemanager.domain.enums.FieldKind;
import com.audiencemanager.domain.model.CompileWarning;
import com.audiencemanager.domain.model.CompiledQuery;
import com.audiencemanager.domain.model.Condition;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Compiles a rule's condition list into a segment query over the unified transaction view.
 *
 * <p>The generated query has three parts:
 * <ul>
 *   <li>an {@code all_transactions} CTE that unions every configured raw source and tags
 *       each row with its {@code source_type}</li>
 *   <li>a WHERE clause with the conjunction of all raw-field predicates
 *       ({@code 1=1} when there are none)</li>
 *   <li>a per-user aggregation ({@code total_transactions}, {@code total_spent},
 *       {@code transaction_types}) with a HAVING clause for metric predicates</li>
 * </ul>
 *
 * <p>Compilation is best effort: a condition with a missing or unknown field, a missing or
 * disallowed operator, or an unusable value is skipped and reported as a
 * {@link CompileWarning}; the remaining conditions still compile. Predicates are
 * de-duplicated and sorted, so the same conditions in any order produce the same SQL.
 */
@Service
@EnableConfigurationProperties(WarehouseConfig.class)
public class ConditionCompiler {

    private static final Logger log = LoggerFactory.getLogger(ConditionCompiler.class);

    /** Widest integer part and fraction a numeric literal may have (DECIMAL(38) range). */
    static final int MAX_NUMERIC_DIGITS = 38;

    private final WarehouseConfig warehouseConfig;

    public ConditionCompiler(WarehouseConfig warehouseConfig) {
        this.warehouseConfig = warehouseConfig;
    }

    /**
     * Compiles the conditions into a read-only aggregation query.
     *
     * @param conditions canonical conditions, may be empty or null
     * @return the query, its rendered predicates and the warnings for dropped conditions
     */
    public CompiledQuery compile(List<Condition> conditions) {
        TreeSet<String> where = new TreeSet<>();
        TreeSet<String> having = new TreeSet<>();
        List<CompileWarning> warnings = new ArrayList<>();

        List<Condition> input = conditions != null ? conditions : List.of();
        for (int i = 0; i < input.size(); i++) {
            Condition condition = input.get(i);
            try {
                CompiledPredicate predicate = compileCondition(condition);
                if (predicate.field().getKind() == FieldKind.PRE_AGGREGATION) {
                    where.add(predicate.sql());
                } else {
                    having.add(predicate.sql());
                }
            } catch (InvalidConditionException e) {
                CompileWarning warning = CompileWarning.builder()
                        .index(i)
                        .condition(condition)
                        .reason(e.reason)
                        .message(e.getMessage())
                        .build();
                warnings.add(warning);
                log.warn("Skipping condition #{} {}: {} ({})", i, condition, e.getMessage(), e.reason);
            }
        }

        List<String> wherePredicates = List.copyOf(where);
        List<String> havingPredicates = List.copyOf(having);
        String sql = buildSql(wherePredicates, havingPredicates);

        log.debug("Compiled {} conditions ({} dropped): {}", input.size(), warnings.size(), sql);

        return CompiledQuery.builder()
                .sql(sql)
                .wherePredicates(wherePredicates)
                .havingPredicates(havingPredicates)
                .warnings(List.copyOf(warnings))
                .build();
    }

    // ---- Query assembly ----

    private String buildSql(List<String> where, List<String> having) {
        String unifiedView = warehouseConfig.getSources().stream()
                .map(this::sourceSelect)
                .collect(Collectors.joining(" UNION ALL "));

        StringBuilder sql = new StringBuilder();
        sql.append("WITH all_transactions AS (").append(unifiedView).append(") ");
        sql.append("SELECT user_id, COUNT(*) AS total_transactions, SUM(amount) AS total_spent, ")
                .append(warehouseConfig.getDialect().distinctConcat("source_type"))
                .append(" AS transaction_types ");
        sql.append("FROM all_transactions ");
        sql.append("WHERE ").append(where.isEmpty() ? "1=1" : String.join(" AND ", where)).append(' ');
        sql.append("GROUP BY user_id");
        if (!having.isEmpty()) {
            sql.append(" HAVING ").append(String.join(" AND ", having));
        }
        return sql.toString();
    }

    private String sourceSelect(TransactionSource source) {
        return "SELECT user_id, amount, transaction_date, category, city_tier, "
                + quote(source.getSourceType()) + " AS source_type FROM " + source.getTable();
    }

    // ---- Per-condition compilation ----

    private CompiledPredicate compileCondition(Condition condition) {
        if (condition == null) {
            throw new InvalidConditionException(CompileWarningReason.MISSING_FIELD, "condition is null");
        }
        if (isBlank(condition.getField())) {
            throw new InvalidConditionException(CompileWarningReason.MISSING_FIELD, "field is missing");
        }
        if (isBlank(condition.getOperator())) {
            throw new InvalidConditionException(CompileWarningReason.MISSING_OPERATOR, "operator is missing");
        }
        if (condition.getValue() == null) {
            throw new InvalidConditionException(CompileWarningReason.MISSING_VALUE, "value is missing");
        }

        ConditionField field = ConditionField.fromKey(condition.getField())
                .orElseThrow(() -> new InvalidConditionException(
                        CompileWarningReason.UNKNOWN_FIELD, "unknown field '" + condition.getField() + "'"));

        ConditionOperator operator = ConditionOperator.fromSymbol(condition.getOperator())
                .filter(field::allows)
                .orElseThrow(() -> new InvalidConditionException(
                        CompileWarningReason.UNSUPPORTED_OPERATOR,
                        "operator '" + condition.getOperator() + "' is not allowed for " + field.getKey()));

        String expression = field.getSqlExpression();
        String sql;
        if (operator == ConditionOperator.BETWEEN) {
            if (condition.getValue2() == null) {
                throw new InvalidConditionException(
                        CompileWarningReason.MISSING_VALUE, "BETWEEN requires value2 as upper bound");
            }
            sql = expression + " BETWEEN " + literal(field, condition.getValue()) + " AND "
                    + literal(field, condition.getValue2());
        } else if (operator.isListOperator()) {
            if (!(condition.getValue() instanceof Collection<?> values)) {
                throw new InvalidConditionException(
                        CompileWarningReason.INVALID_VALUE, operator.getSymbol() + " requires a list value");
            }
            if (values.isEmpty()) {
                throw new InvalidConditionException(
                        CompileWarningReason.EMPTY_IN_LIST, operator.getSymbol() + " requires a non-empty list");
            }
            TreeSet<String> literals = new TreeSet<>();
            for (Object value : values) {
                literals.add(literal(field, value));
            }
            sql = expression + " " + operator.getSymbol() + " (" + String.join(", ", literals) + ")";
        } else {
            sql = expression + " " + operator.getSymbol() + " " + literal(field, condition.getValue());
        }
        return new CompiledPredicate(field, sql);
    }

    private String literal(ConditionField field, Object value) {
        if (value == null || value instanceof Collection<?>) {
            throw new InvalidConditionException(
                    CompileWarningReason.INVALID_VALUE, "expected a single value for " + field.getKey());
        }
        return switch (field.getValueType()) {
            case NUMBER -> numericLiteral(value)
                    .orElseThrow(() -> new InvalidConditionException(
                            CompileWarningReason.INVALID_VALUE,
                            "'" + value + "' is not a number within " + MAX_NUMERIC_DIGITS + " digits for " + field.getKey()));
            case DATE -> {
                if (!isDate(String.valueOf(value))) {
                    throw new InvalidConditionException(
                            CompileWarningReason.INVALID_VALUE,
                            "'" + value + "' is not an ISO date for " + field.getKey());
                }
                yield quote(String.valueOf(value).trim());
            }
            case TEXT -> quote(String.valueOf(value));
        };
    }

    private static Optional<String> numericLiteral(Object value) {
        if (value instanceof Boolean) {
            return Optional.empty();
        }
        BigDecimal number;
        try {
            number = new BigDecimal(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        // toPlainString expands the exponent, so "1e400000000" must be rejected before rendering
        int integerDigits = number.precision() - number.scale();
        if (integerDigits > MAX_NUMERIC_DIGITS || number.scale() > MAX_NUMERIC_DIGITS) {
            return Optional.empty();
        }
        return Optional.of(number.toPlainString());
    }

    private static boolean isDate(String value) {
        String trimmed = value.trim();
        try {
            LocalDate.parse(trimmed);
            return true;
        } catch (DateTimeParseException e) {
            try {
                LocalDateTime.parse(trimmed);
                return true;
            } catch (DateTimeParseException ignored) {
                return false;
            }
        }
    }

    static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record CompiledPredicate(ConditionField field, String sql) {}

    /** Internal signal for a condition that cannot be compiled; never escapes {@link #compile}. */
    private static final class InvalidConditionException extends RuntimeException {

        private final CompileWarningReason reason;

        InvalidConditionException(CompileWarningReason reason, String message) {
            super(message);
            this.reason = reason;
        }
    }
}
