package com.starscape.mediacatalog.common.exception;

public class StorageException extends BusinessException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, cause);
    }
}
