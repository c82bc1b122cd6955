package com.starscape.mediacatalog.common.exception;

/**
 * Base class for every error the registries raise. The {@link ErrorCode}
 * identifies the failure; the message is meant for logs.
 */
public class BusinessException extends RuntimeException {

    private final ErrorCode code;

    public BusinessException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public BusinessException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
