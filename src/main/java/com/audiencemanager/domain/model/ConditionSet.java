package com.audiencemanager.domain.model;

import com.audiencemanager.domain.enums.ConditionOperator;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Order-independent, duplicate-free representation of a condition list.
 *
 * <p>Every condition is reduced to a canonical tuple: its non-null attributes sorted by
 * name, with values normalized so that {@code 1000}, {@code 1000.0} and {@code "1000"}
 * compare equal and list values compare irrespective of element order. Two condition
 * lists holding the same conditions in any order produce equal sets. This is the
 * comparison primitive of the subset-cover dependency resolution.
 */
public final class ConditionSet {

    private static final int PLAIN_SCALE_LIMIT = 64;

    private static final ConditionSet EMPTY = new ConditionSet(Collections.emptySortedSet());

    private final Set<String> tuples;

    private ConditionSet(Set<String> tuples) {
        this.tuples = Collections.unmodifiableSet(tuples);
    }

    public static ConditionSet of(List<Condition> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            return EMPTY;
        }
        TreeSet<String> tuples = conditions.stream()
                .filter(Objects::nonNull)
                .map(ConditionSet::canonicalTuple)
                .collect(Collectors.toCollection(TreeSet::new));
        return new ConditionSet(tuples);
    }

    /** Canonical tuple of one condition, e.g. {@code (field=amount, operator=>, value=1000)}. */
    public static String canonicalTuple(Condition condition) {
        Map<String, String> pairs = new TreeMap<>();
        if (condition.getField() != null) {
            pairs.put("field", condition.getField().trim().toLowerCase(Locale.ROOT));
        }
        if (condition.getOperator() != null) {
            pairs.put(
                    "operator",
                    ConditionOperator.fromSymbol(condition.getOperator())
                            .map(ConditionOperator::getSymbol)
                            .orElse(condition.getOperator().trim().toUpperCase(Locale.ROOT)));
        }
        if (condition.getValue() != null) {
            pairs.put("value", normalizeValue(condition.getValue()));
        }
        if (condition.getValue2() != null) {
            pairs.put("value2", normalizeValue(condition.getValue2()));
        }
        return pairs.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "(", ")"));
    }

    static String normalizeValue(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                    .map(ConditionSet::normalizeValue)
                    .sorted()
                    .collect(Collectors.joining(",", "[", "]"));
        }
        String text = String.valueOf(value).trim();
        BigDecimal number;
        try {
            number = new BigDecimal(text).stripTrailingZeros();
        } catch (NumberFormatException e) {
            return "'" + text + "'";
        }
        // Scientific form keeps keys for huge exponents short; they never compile anyway
        return Math.abs(number.scale()) > PLAIN_SCALE_LIMIT ? number.toString() : number.toPlainString();
    }

    public boolean contains(String tuple) {
        return tuples.contains(tuple);
    }

    public boolean isSubsetOf(ConditionSet other) {
        return other.tuples.containsAll(tuples);
    }

    public ConditionSet minus(ConditionSet other) {
        TreeSet<String> remaining = new TreeSet<>(tuples);
        remaining.removeAll(other.tuples);
        return new ConditionSet(remaining);
    }

    public int size() {
        return tuples.size();
    }

    public boolean isEmpty() {
        return tuples.isEmpty();
    }

    public Set<String> tuples() {
        return tuples;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConditionSet other)) {
            return false;
        }
        return tuples.equals(other.tuples);
    }

    @Override
    public int hashCode() {
        return tuples.hashCode();
    }

    @Override
    public String toString() {
        return tuples.toString();
    }
}
