package com.audiencemanager.exception;

/**
 * Raised by a {@code BatchEngine} when a query, table load or table write fails.
 */
public class BatchEngineException extends BaseException {

    public BatchEngineException(String message, Throwable cause) {
        super(ErrorCode.EXECUTION_FAILED, message, cause);
    }

    public BatchEngineException(String message) {
        super(ErrorCode.EXECUTION_FAILED, message);
    }
}
