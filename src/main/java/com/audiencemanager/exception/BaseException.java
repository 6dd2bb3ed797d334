package com.audiencemanager.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.Getter;

/**
 * Root of every failure the audience manager reports through its API.
 *
 * <p>The {@link ErrorCode} fixes the HTTP status; {@link #getDetails()} is rendered
 * verbatim under {@code error.details} (rule ids, compile warnings, offending fields).
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
        this.details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /** True when the failure is ours rather than the caller's; such failures are logged with a stack trace. */
    public boolean isServerFault() {
        return errorCode.getHttpStatus() >= 500;
    }
}
