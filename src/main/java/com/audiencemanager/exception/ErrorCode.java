package com.audiencemanager.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CONFLICT("CONFLICT", 409),
    SCHEDULER_UNAVAILABLE("SCHEDULER_UNAVAILABLE", 503),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    DEPENDENCY_LOAD_FAILED("DEPENDENCY_LOAD_FAILED", 500),
    EXECUTION_FAILED("EXECUTION_FAILED", 500),
    METADATA_UPDATE_FAILED("METADATA_UPDATE_FAILED", 500);

    private final String code;
    private final int httpStatus;
}
