package com.tariffwise.core.llm;

/**
 * Thrown when the model returns neither text nor tool calls.
 */
public class LlmEmptyResponseException extends ProviderUnavailableException {

    public LlmEmptyResponseException(String provider, String message) {
        super(provider, message);
    }
}
