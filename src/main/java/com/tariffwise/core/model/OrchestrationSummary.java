package com.tariffwise.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Map;

/**
 * Condensed view of the model run behind a payload.
 *
 * @param modelInvoked    false when every line was answered from memory
 * @param outcome         orchestration outcome name, or "SKIPPED"
 * @param provider        provider that produced the final text; nullable
 * @param providerSwitched whether the secondary provider took over
 * @param rounds          number of completed rounds
 * @param toolInvocations invocation count per tool
 * @param costUsd         total provider cost for the request
 * @param elapsedMs       orchestration wall time
 */
public record OrchestrationSummary(
    @JsonProperty("model_invoked") boolean modelInvoked,
    String outcome,
    String provider,
    @JsonProperty("provider_switched") boolean providerSwitched,
    int rounds,
    @JsonProperty("tool_invocations") Map<String, Integer> toolInvocations,
    @JsonProperty("cost_usd") double costUsd,
    @JsonProperty("elapsed_ms") long elapsedMs
) implements Serializable {

    public OrchestrationSummary {
        toolInvocations = toolInvocations == null ? Map.of() : Map.copyOf(toolInvocations);
    }

    public static OrchestrationSummary skipped() {
        return new OrchestrationSummary(false, "SKIPPED", null, false, 0, Map.of(), 0.0, 0L);
    }
}
