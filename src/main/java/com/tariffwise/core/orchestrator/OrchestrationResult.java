package com.tariffwise.core.orchestrator;

import com.tariffwise.core.model.OrchestrationSummary;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Final text of a run, or a terminal failure, with the full round history.
 */
public record OrchestrationResult(
    OrchestrationOutcome outcome,
    String finalText,
    String provider,
    boolean providerSwitched,
    List<ToolCallRound> rounds,
    List<ProviderFailure> providerFailures,
    Map<String, Integer> toolInvocationCounts,
    double costUsd,
    Duration elapsed
) {

    public OrchestrationResult {
        finalText = finalText == null ? "" : finalText;
        rounds = List.copyOf(rounds);
        providerFailures = List.copyOf(providerFailures);
        toolInvocationCounts = Map.copyOf(toolInvocationCounts);
    }

    /** True when no classification text was produced; the caller must take the manual path. */
    public boolean isFailure() {
        return outcome == OrchestrationOutcome.FAILED;
    }

    public boolean isDegraded() {
        return outcome.isDegraded();
    }

    public OrchestrationSummary summary() {
        return new OrchestrationSummary(true, outcome.name(), provider, providerSwitched, rounds.size(),
                toolInvocationCounts, costUsd, elapsed.toMillis());
    }
}
