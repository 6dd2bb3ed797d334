package com.audiencemanager.domain.enums;

/**
 * How a composite segment combines the user sets of the segments it depends on.
 * Operands are matched on {@code user_id}.
 */
public enum SetOperation {
    /** Users present in any operand, de-duplicated. */
    UNION,
    /** Users present in every operand, folded pairwise from the first. */
    INTERSECTION,
    /** Users of the first operand minus those in any later operand. */
    DIFFERENCE
}
