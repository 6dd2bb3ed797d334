package com.audiencemanager.domain.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Immutable dataset with the fixed segment output schema
 * ({@code user_id, total_transactions, total_spent, transaction_types}).
 */
public final class SegmentDataset {

    public static final List<String> COLUMNS =
            List.of("user_id", "total_transactions", "total_spent", "transaction_types");

    private static final SegmentDataset EMPTY = new SegmentDataset(List.of());

    private final List<SegmentRow> rows;

    private SegmentDataset(List<SegmentRow> rows) {
        this.rows = Collections.unmodifiableList(rows);
    }

    public static SegmentDataset of(List<SegmentRow> rows) {
        return rows == null || rows.isEmpty() ? EMPTY : new SegmentDataset(List.copyOf(rows));
    }

    public static SegmentDataset ofUsers(long... userIds) {
        return of(Arrays.stream(userIds).mapToObj(SegmentRow::ofUser).toList());
    }

    public static SegmentDataset empty() {
        return EMPTY;
    }

    public List<SegmentRow> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /** User ids in row order. */
    public Set<Long> userIds() {
        return rows.stream().map(SegmentRow::getUserId).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public SegmentDataset filter(Predicate<SegmentRow> predicate) {
        return of(rows.stream().filter(predicate).toList());
    }

    public SegmentDataset withoutNullUsers() {
        return filter(row -> row.getUserId() != null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SegmentDataset other && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows);
    }

    @Override
    public String toString() {
        return "SegmentDataset" + userIds();
    }
}
