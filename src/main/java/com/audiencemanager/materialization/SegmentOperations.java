package com.audiencemanager.materialization;

import com.audiencemanager.domain.model.SegmentDataset;
import com.audiencemanager.domain.model.SegmentRow;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Set algebra over segment datasets, keyed on {@code user_id}.
 *
 * <p>Row attributes are taken from the first operand that contains the user; the other
 * operands only decide membership. Rows without a user id never survive.
 */
public final class SegmentOperations {

    private SegmentOperations() {}

    public static SegmentDataset union(SegmentDataset... datasets) {
        Map<Long, SegmentRow> byUser = new LinkedHashMap<>();
        for (SegmentDataset dataset : datasets) {
            if (dataset == null) {
                continue;
            }
            for (SegmentRow row : dataset.rows()) {
                if (row.getUserId() != null) {
                    byUser.putIfAbsent(row.getUserId(), row);
                }
            }
        }
        return SegmentDataset.of(new ArrayList<>(byUser.values()));
    }

    public static SegmentDataset intersect(SegmentDataset left, SegmentDataset right) {
        Set<Long> keep = right.userIds();
        return distinctUsers(left.filter(row -> row.getUserId() != null && keep.contains(row.getUserId())));
    }

    public static SegmentDataset except(SegmentDataset left, SegmentDataset right) {
        Set<Long> drop = right.userIds();
        return distinctUsers(left.filter(row -> row.getUserId() != null && !drop.contains(row.getUserId())));
    }

    private static SegmentDataset distinctUsers(SegmentDataset dataset) {
        return union(dataset);
    }
}
