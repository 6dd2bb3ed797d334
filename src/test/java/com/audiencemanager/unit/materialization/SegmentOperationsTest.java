package com.audiencemanager.unit.materialization;

import static org.assertj.core.api.Assertions.assertThat;

import com.audiencemanager.domain.model.SegmentDataset;
import com.audiencemanager.domain.model.SegmentRow;
import com.audiencemanager.materialization.SegmentOperations;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SegmentOperationsTest {

    private static SegmentRow row(Long userId, long transactions) {
        return new SegmentRow(userId, transactions, BigDecimal.valueOf(transactions * 100), "UPI");
    }

    @Test
    @DisplayName("union de-duplicates users and keeps the first row seen")
    void unionFirstWins() {
        SegmentDataset left = SegmentDataset.of(List.of(row(1L, 5), row(2L, 1)));
        SegmentDataset right = SegmentDataset.of(List.of(row(2L, 9), row(3L, 2)));

        SegmentDataset result = SegmentOperations.union(left, right);

        assertThat(result.userIds()).containsExactly(1L, 2L, 3L);
        assertThat(result.rows().get(1).getTotalTransactions()).isEqualTo(1L);
    }

    @Test
    @DisplayName("union of a single dataset removes duplicate and null users")
    void unionSingleDedup() {
        SegmentDataset dataset = SegmentDataset.of(List.of(row(1L, 1), row(null, 2), row(1L, 3)));

        assertThat(SegmentOperations.union(dataset).userIds()).containsExactly(1L);
    }

    @Test
    @DisplayName("intersect keeps users present on both sides with left attributes")
    void intersect() {
        SegmentDataset left = SegmentDataset.of(List.of(row(1L, 5), row(2L, 6), row(3L, 7)));
        SegmentDataset right = SegmentDataset.ofUsers(3, 1, 4);

        SegmentDataset result = SegmentOperations.intersect(left, right);

        assertThat(result.userIds()).containsExactly(1L, 3L);
        assertThat(result.rows().get(1).getTotalTransactions()).isEqualTo(7L);
    }

    @Test
    @DisplayName("except removes users present on the right")
    void except() {
        SegmentDataset left = SegmentDataset.ofUsers(1, 2, 3, 2);
        SegmentDataset right = SegmentDataset.ofUsers(2);

        assertThat(SegmentOperations.except(left, right).userIds()).containsExactly(1L, 3L);
    }

    @Test
    @DisplayName("operations on empty datasets yield empty datasets")
    void emptyOperands() {
        SegmentDataset users = SegmentDataset.ofUsers(1, 2);

        assertThat(SegmentOperations.intersect(users, SegmentDataset.empty()).isEmpty()).isTrue();
        assertThat(SegmentOperations.except(SegmentDataset.empty(), users).isEmpty()).isTrue();
        assertThat(SegmentOperations.union()).isEqualTo(SegmentDataset.empty());
    }
}
