package com.audiencemanager.api.dto.response;

import com.audiencemanager.exception.BaseException;
import com.audiencemanager.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Failure envelope: {@code {"success": false, "error": {...}}}. Written by
 * {@code GlobalExceptionHandler} and passed through untouched by {@code ApiResponseAdvice}.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .path(path)
                .timestamp(Instant.now())
                .build());
    }

    public static ApiErrorResponse from(BaseException ex, String path) {
        return of(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), path);
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        private final String code;
        private final int status;
        private final String message;
        /** Rule ids, compile warnings or field errors, depending on the failure. */
        private final Map<String, Object> details;
        private final String path;
        private final Instant timestamp;
    }
}
