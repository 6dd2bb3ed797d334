package com.audiencemanager.domain.enums;

/**
 * Where a condition field is evaluated in the compiled segment query.
 */
public enum FieldKind {
    /** Column of a raw transaction row, rendered in the WHERE clause. */
    PRE_AGGREGATION,
    /** Per-user metric computed by the GROUP BY, rendered in the HAVING clause. */
    POST_AGGREGATION
}
