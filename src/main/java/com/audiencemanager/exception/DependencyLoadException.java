package com.audiencemanager.exception;

import lombok.Getter;

/**
 * A composite segment could not load one of its operand tables. The whole run is
 * aborted because a combination with a missing operand is meaningless.
 */
@Getter
public class DependencyLoadException extends MaterializationException {

    private final Long dependencyRuleId;

    public DependencyLoadException(Long ruleId, Long dependencyRuleId, String message, Throwable cause) {
        super(ErrorCode.DEPENDENCY_LOAD_FAILED, ruleId, message, cause);
        this.dependencyRuleId = dependencyRuleId;
    }
}
