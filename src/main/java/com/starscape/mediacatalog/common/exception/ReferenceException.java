package com.starscape.mediacatalog.common.exception;

/**
 * A referenced entity owned by another registry could not be resolved.
 * The cause is the error that registry reported.
 */
public class ReferenceException extends BusinessException {

    public ReferenceException(ErrorCode code, String message, BusinessException cause) {
        super(code, message, cause);
    }

    /**
     * The error code reported by the registry that owns the referenced entity.
     */
    public ErrorCode getReferenceCode() {
        return ((BusinessException) getCause()).getCode();
    }
}
