package com.tariffwise.core.orchestrator;

/**
 * A provider call that failed. Failed calls do not create rounds.
 */
public record ProviderFailure(String provider, int roundIndex, String reason) {}
