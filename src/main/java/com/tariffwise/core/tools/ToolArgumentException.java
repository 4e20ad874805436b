package com.tariffwise.core.tools;

/**
 * Thrown when tool arguments are missing, malformed or of the wrong type.
 */
public class ToolArgumentException extends RuntimeException {

    public ToolArgumentException(String message) {
        super(message);
    }

    public ToolArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
