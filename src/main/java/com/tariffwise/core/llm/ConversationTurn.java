package com.tariffwise.core.llm;

import java.util.List;

/**
 * Provider-neutral transcript entry.
 *
 * @param role       who produced the turn
 * @param text       message text, or the JSON result for {@link Role#TOOL_RESULT}
 * @param toolCalls  tool calls requested by an assistant turn
 * @param toolCallId id of the call a tool result answers
 * @param toolName   name of the tool a tool result answers
 */
public record ConversationTurn(
    Role role,
    String text,
    List<ToolCallRequest> toolCalls,
    String toolCallId,
    String toolName
) {

    public enum Role { USER, ASSISTANT, TOOL_RESULT }

    public ConversationTurn {
        text = text == null ? "" : text;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ConversationTurn user(String text) {
        return new ConversationTurn(Role.USER, text, List.of(), null, null);
    }

    public static ConversationTurn assistant(String text, List<ToolCallRequest> toolCalls) {
        return new ConversationTurn(Role.ASSISTANT, text, toolCalls, null, null);
    }

    public static ConversationTurn toolResult(String toolCallId, String toolName, String resultJson) {
        return new ConversationTurn(Role.TOOL_RESULT, resultJson, List.of(), toolCallId, toolName);
    }
}
