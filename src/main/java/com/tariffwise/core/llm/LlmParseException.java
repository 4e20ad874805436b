package com.tariffwise.core.llm;

/**
 * Thrown when model output cannot be read as a classification payload.
 */
public class LlmParseException extends RuntimeException {

    public LlmParseException(String message) {
        super(message);
    }

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
