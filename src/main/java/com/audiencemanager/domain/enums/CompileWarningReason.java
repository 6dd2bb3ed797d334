package com.audiencemanager.domain.enums;

/** Why the condition compiler dropped a condition. */
public enum CompileWarningReason {
    MISSING_FIELD,
    MISSING_OPERATOR,
    MISSING_VALUE,
    UNKNOWN_FIELD,
    UNSUPPORTED_OPERATOR,
    EMPTY_IN_LIST,
    INVALID_VALUE
}
