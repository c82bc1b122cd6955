package com.starscape.mediacatalog.common.exception;

/**
 * The entity is in a state that forbids the operation, e.g. it still has
 * dependents.
 */
public class StateException extends BusinessException {

    public StateException(ErrorCode code, String message) {
        super(code, message);
    }

    public StateException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
