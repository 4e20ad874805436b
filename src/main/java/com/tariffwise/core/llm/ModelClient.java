package com.tariffwise.core.llm;

/**
 * One inference backend behind a normalized request/reply shape.
 * <p>
 * Provider-specific message and tool-call formats stay inside the implementation.
 * Implementations are synchronous and throw {@link ProviderUnavailableException} on any
 * transport, authentication or empty-response failure.
 */
public interface ModelClient {

    /** Short provider label used in logs, metrics and round records. */
    String name();

    ModelReply complete(ModelCallRequest request);
}
