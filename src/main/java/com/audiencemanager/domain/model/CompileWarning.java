package com.audiencemanager.domain.model;

import com.audiencemanager.domain.enums.CompileWarningReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A condition the compiler skipped. Compilation continues without it; callers decide
 * whether a rule with warnings is acceptable.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString
public class CompileWarning {

    /** Position of the dropped condition in the compiled list. */
    private final int index;

    private final Condition condition;
    private final CompileWarningReason reason;
    private final String message;
}
