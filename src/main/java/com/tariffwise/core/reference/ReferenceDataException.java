package com.tariffwise.core.reference;

/**
 * Thrown when the reference dataset cannot be read.
 */
public class ReferenceDataException extends RuntimeException {

    public ReferenceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
