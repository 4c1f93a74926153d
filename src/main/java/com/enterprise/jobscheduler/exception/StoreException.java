package com.enterprise.jobscheduler.exception;

/**
 * Unchecked wrapper for storage and serialization failures.
 * The write has been rolled back; callers may retry.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
