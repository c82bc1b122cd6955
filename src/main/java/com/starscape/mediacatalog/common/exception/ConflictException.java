package com.starscape.mediacatalog.common.exception;

/**
 * The write would break a uniqueness or containment rule.
 */
public class ConflictException extends BusinessException {

    public ConflictException(ErrorCode code, String message) {
        super(code, message);
    }

    public ConflictException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
