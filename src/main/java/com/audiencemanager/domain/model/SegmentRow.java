package com.audiencemanager.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One row of a segment output table. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SegmentRow {

    private Long userId;
    private Long totalTransactions;
    private BigDecimal totalSpent;
    private String transactionTypes;

    public static SegmentRow ofUser(long userId) {
        return new SegmentRow(userId, 0L, BigDecimal.ZERO, null);
    }
}
