package com.aim.auth.exception;

/**
 * The user store could not be reached in time. Surfaced as 503.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
