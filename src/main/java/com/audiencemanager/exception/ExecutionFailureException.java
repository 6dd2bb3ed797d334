package com.audiencemanager.exception;

public class ExecutionFailureException extends MaterializationException {

    public ExecutionFailureException(Long ruleId, String message, Throwable cause) {
        super(ErrorCode.EXECUTION_FAILED, ruleId, message, cause);
    }
}
