package com.audiencemanager.materialization;

import com.audiencemanager.domain.model.SegmentDataset;

/**
 * Boundary to the engine that stores and computes segment datasets.
 *
 * <p>Every dataset has the fixed segment schema
 * ({@code user_id, total_transactions, total_spent, transaction_types}). Set operations
 * match rows on {@code user_id}. Implementations throw
 * {@link com.audiencemanager.exception.BatchEngineException} on any failure.
 */
public interface BatchEngine {

    /** Runs a read-only segment query. */
    SegmentDataset readQuery(String sql);

    /** Loads a whole output table; fails if it does not exist. */
    SegmentDataset readTable(String tableName);

    boolean tableExists(String tableName);

    /** Replaces the table with the dataset (drop then create). An empty dataset yields an empty table. */
    void writeTable(SegmentDataset dataset, String tableName);

    /** Drops the table; a missing table is not an error. */
    void dropTable(String tableName);

    SegmentDataset sampleRows(String tableName, int limit);

    /** Rows of every operand, de-duplicated on {@code user_id}, first occurrence wins. */
    default SegmentDataset union(SegmentDataset... datasets) {
        return SegmentOperations.union(datasets);
    }

    /** Rows of {@code left} whose user is also in {@code right}. */
    default SegmentDataset intersect(SegmentDataset left, SegmentDataset right) {
        return SegmentOperations.intersect(left, right);
    }

    /** Rows of {@code left} whose user is not in {@code right}. */
    default SegmentDataset except(SegmentDataset left, SegmentDataset right) {
        return SegmentOperations.except(left, right);
    }
}
