package com.tariffwise.core.orchestrator;

import com.tariffwise.core.llm.ConversationTurn;
import com.tariffwise.core.llm.ToolCallRequest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only conversation for one provider's run. Entries are never edited or removed; a
 * provider switch starts a new transcript.
 */
final class Transcript {

    private final String systemPrompt;
    private final List<ConversationTurn> turns = new ArrayList<>();

    private Transcript(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    static Transcript start(OrchestrationPrompt prompt) {
        Transcript transcript = new Transcript(prompt.systemPrompt());
        transcript.turns.add(ConversationTurn.user(prompt.userPrompt()));
        return transcript;
    }

    void appendAssistant(String text, List<ToolCallRequest> toolCalls) {
        turns.add(ConversationTurn.assistant(text, toolCalls));
    }

    void appendToolResult(String callId, String toolName, String resultJson) {
        turns.add(ConversationTurn.toolResult(callId, toolName, resultJson));
    }

    String systemPrompt() {
        return systemPrompt;
    }

    List<ConversationTurn> turns() {
        return Collections.unmodifiableList(new ArrayList<>(turns));
    }

    int size() {
        return turns.size();
    }
}
