package com.tariffwise.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link ModelClient} over a Spring AI {@link ChatModel}.
 * <p>
 * Tool execution inside Spring AI is disabled: tool calls are returned to the caller so the
 * orchestrator can run them through its own dispatcher and budget. Token usage is priced with
 * the configured {@link ModelCatalog.ModelInfo}.
 */
public class SpringAiModelClient implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiModelClient.class);

    private final String name;
    private final ChatModel chatModel;
    private final ModelCatalog.ModelInfo pricing;

    public SpringAiModelClient(String name, ChatModel chatModel, ModelCatalog.ModelInfo pricing) {
        this.name = name;
        this.chatModel = chatModel;
        this.pricing = pricing;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ModelReply complete(ModelCallRequest request) {
        Prompt prompt = new Prompt(toMessages(request), toOptions(request));
        long start = System.currentTimeMillis();
        ChatResponse response;
        try {
            response = chatModel.call(prompt);
        } catch (RuntimeException e) {
            log.warn("Provider '{}' call failed: {}", name, e.getMessage());
            throw new ProviderUnavailableException(name, "Provider " + name + " call failed: " + e.getMessage(), e);
        }
        long latency = System.currentTimeMillis() - start;

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new LlmEmptyResponseException(name, "Provider " + name + " returned no generation");
        }
        AssistantMessage output = response.getResult().getOutput();
        String text = output.getText() == null ? "" : output.getText();
        List<ToolCallRequest> toolCalls = toToolCalls(output);
        if (text.isBlank() && toolCalls.isEmpty()) {
            throw new LlmEmptyResponseException(name, "Provider " + name + " returned empty content");
        }

        ModelUsage usage = toUsage(response, latency);
        log.info("Provider '{}' replied in {}ms ({} tool call(s), {} prompt / {} completion tokens)",
                name, latency, toolCalls.size(), usage.promptTokens(), usage.completionTokens());
        log.debug("Raw reply from '{}': {}", name, text);
        return new ModelReply(text, toolCalls, usage);
    }

    private List<Message> toMessages(ModelCallRequest request) {
        List<Message> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(new SystemMessage(request.systemPrompt()));
        }
        List<ToolResponseMessage.ToolResponse> pendingResults = new ArrayList<>();
        for (ConversationTurn turn : request.turns()) {
            if (turn.role() == ConversationTurn.Role.TOOL_RESULT) {
                pendingResults.add(new ToolResponseMessage.ToolResponse(
                        turn.toolCallId(), turn.toolName(), turn.text()));
                continue;
            }
            // results answering one assistant turn travel together
            flushToolResults(messages, pendingResults);
            if (turn.role() == ConversationTurn.Role.USER) {
                messages.add(new UserMessage(turn.text()));
            } else {
                List<AssistantMessage.ToolCall> calls = turn.toolCalls().stream()
                        .map(c -> new AssistantMessage.ToolCall(c.id(), "function", c.name(), c.argumentsJson()))
                        .toList();
                messages.add(new AssistantMessage(turn.text(), Map.of(), calls));
            }
        }
        flushToolResults(messages, pendingResults);
        return messages;
    }

    private static void flushToolResults(List<Message> messages, List<ToolResponseMessage.ToolResponse> pending) {
        if (!pending.isEmpty()) {
            messages.add(new ToolResponseMessage(List.copyOf(pending)));
            pending.clear();
        }
    }

    private ChatOptions toOptions(ModelCallRequest request) {
        List<ToolCallback> callbacks = request.tools().stream()
                .map(SchemaOnlyToolCallback::new)
                .map(ToolCallback.class::cast)
                .toList();
        return ToolCallingChatOptions.builder()
                .model(pricing.id())
                .temperature(request.temperature())
                .maxTokens(request.maxTokens())
                .toolCallbacks(callbacks)
                .internalToolExecutionEnabled(false)
                .build();
    }

    private static List<ToolCallRequest> toToolCalls(AssistantMessage output) {
        if (!output.hasToolCalls()) {
            return List.of();
        }
        List<ToolCallRequest> calls = new ArrayList<>();
        int index = 0;
        for (AssistantMessage.ToolCall call : output.getToolCalls()) {
            // some OpenAI-compatible backends omit call ids
            String id = call.id() == null || call.id().isBlank() ? "call_" + index : call.id();
            calls.add(new ToolCallRequest(id, call.name(), call.arguments()));
            index++;
        }
        return calls;
    }

    private ModelUsage toUsage(ChatResponse response, long latency) {
        Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        long prompt = usage != null && usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
        long completion = usage != null && usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
        return new ModelUsage(prompt, completion, pricing.cost(prompt, completion), latency);
    }

    /**
     * Advertises a tool schema to the model. Execution happens in the orchestrator, never here.
     */
    private static final class SchemaOnlyToolCallback implements ToolCallback {

        private final ToolDefinition definition;

        SchemaOnlyToolCallback(ToolSpec spec) {
            this.definition = ToolDefinition.builder()
                    .name(spec.name())
                    .description(spec.description())
                    .inputSchema(spec.inputSchema())
                    .build();
        }

        @Override
        public ToolDefinition getToolDefinition() {
            return definition;
        }

        @Override
        public String call(String toolInput) {
            throw new UnsupportedOperationException(
                    "Tool '" + definition.name() + "' is executed by the orchestrator, not by the chat model");
        }
    }
}
