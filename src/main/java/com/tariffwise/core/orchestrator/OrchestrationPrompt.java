package com.tariffwise.core.orchestrator;

/**
 * The prepared prompt a run starts from. The transcript is rebuilt from this on a provider switch.
 */
public record OrchestrationPrompt(String systemPrompt, String userPrompt) {}
