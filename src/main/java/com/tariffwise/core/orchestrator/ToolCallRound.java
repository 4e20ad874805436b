package com.tariffwise.core.orchestrator;

import com.tariffwise.core.llm.ModelUsage;

import java.util.List;

/**
 * One completed iteration of the loop. Immutable once created.
 *
 * @param roundIndex      0-based, contiguous within a provider's run
 * @param providerUsed    provider that produced this round's reply
 * @param toolInvocations tool calls executed (or answered with an error envelope) in this round
 * @param emittedText     free text the model produced alongside its tool calls
 * @param usage           token usage and cost of the provider call
 */
public record ToolCallRound(
    int roundIndex,
    String providerUsed,
    List<ToolInvocation> toolInvocations,
    String emittedText,
    ModelUsage usage
) {

    public ToolCallRound {
        toolInvocations = List.copyOf(toolInvocations);
        emittedText = emittedText == null ? "" : emittedText;
    }
}
