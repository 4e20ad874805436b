package com.tariffwise.core.llm;

import java.util.List;

/**
 * Everything a provider needs for one call: the full transcript and the tool schema.
 */
public record ModelCallRequest(
    String systemPrompt,
    List<ConversationTurn> turns,
    List<ToolSpec> tools,
    int maxTokens,
    double temperature
) {

    public ModelCallRequest {
        turns = List.copyOf(turns);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
