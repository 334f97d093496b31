package com.capturebot.common.exception;

/** Upload to, or signing against, blob storage failed. */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
