package com.audiencemanager.exception;

import java.util.Map;

/**
 * A catalog request that was understood but refused: a duplicate rule name, a
 * condition list with nothing valid in it, a trigger while the scheduler is down.
 */
public class BusinessException extends BaseException {

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details, null);
    }
}
