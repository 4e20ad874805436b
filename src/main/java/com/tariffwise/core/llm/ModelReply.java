package com.tariffwise.core.llm;

import java.util.List;

/**
 * Normalized provider reply: free text plus zero or more tool calls.
 */
public record ModelReply(String text, List<ToolCallRequest> toolCalls, ModelUsage usage) {

    public ModelReply {
        text = text == null ? "" : text;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        usage = usage == null ? ModelUsage.NONE : usage;
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
