package com.audiencemanager.exception;

import java.util.Collections;
import lombok.Getter;

/**
 * Base type for failures raised while materializing a segment.
 *
 * <p>Carries the rule being materialized so the executor can record the failure
 * against the right run without parsing messages.
 */
@Getter
public abstract class MaterializationException extends BaseException {

    private final Long ruleId;

    protected MaterializationException(ErrorCode errorCode, Long ruleId, String message, Throwable cause) {
        super(errorCode, message, Collections.singletonMap("ruleId", ruleId), cause);
        this.ruleId = ruleId;
    }
}
