package com.tariffwise.core.llm;

/**
 * Token usage and cost of one provider call.
 */
public record ModelUsage(long promptTokens, long completionTokens, double costUsd, long latencyMs) {

    public static final ModelUsage NONE = new ModelUsage(0, 0, 0.0, 0);
}
