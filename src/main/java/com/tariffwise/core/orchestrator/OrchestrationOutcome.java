package com.tariffwise.core.orchestrator;

/**
 * How a tool-calling run ended.
 */
public enum OrchestrationOutcome {
    /** The model answered without requesting tools. */
    COMPLETED(false),
    /** Round limit reached; the last text is returned. */
    MAX_ROUNDS_REACHED(true),
    /** Time budget spent; the last text is returned. */
    TIME_BUDGET_EXHAUSTED(true),
    /** The caller's deadline passed or the thread was interrupted. */
    CANCELLED(true),
    /** A provider failed after round 0; the last text is returned. */
    PROVIDER_ERROR(true),
    /** No usable text: both providers failed, or a later failure left nothing. */
    FAILED(true);

    private final boolean degraded;

    OrchestrationOutcome(boolean degraded) {
        this.degraded = degraded;
    }

    public boolean isDegraded() {
        return degraded;
    }
}
