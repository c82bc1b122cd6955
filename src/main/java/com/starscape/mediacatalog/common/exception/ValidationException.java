package com.starscape.mediacatalog.common.exception;

/**
 * Input rejected before anything was read or written.
 */
public class ValidationException extends BusinessException {

    public ValidationException(ErrorCode code, String message) {
        super(code, message);
    }
}
