package com.tariffwise.core.persistence;

/**
 * Thrown when the attempt-record store cannot be read or written.
 */
public class AttemptStoreException extends RuntimeException {

    public AttemptStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
