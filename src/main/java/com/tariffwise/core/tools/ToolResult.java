package com.tariffwise.core.tools;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Uniform result envelope for every tool invocation, successful or not.
 */
public record ToolResult(
    String toolName,
    ToolResultStatus status,
    Map<String, Object> data,
    String error,
    long durationMs
) {

    public ToolResult {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static ToolResult ok(String toolName, Map<String, Object> data, long durationMs) {
        return new ToolResult(toolName, ToolResultStatus.OK, data, null, durationMs);
    }

    public static ToolResult error(String toolName, String error, long durationMs) {
        return new ToolResult(toolName, ToolResultStatus.ERROR, Map.of(), error, durationMs);
    }

    public static ToolResult invalidArguments(String toolName, String error) {
        return new ToolResult(toolName, ToolResultStatus.INVALID_ARGUMENTS, Map.of(), error, 0);
    }

    public static ToolResult notFound(String toolName) {
        return new ToolResult(toolName, ToolResultStatus.NOT_FOUND, Map.of(), "Unknown tool: " + toolName, 0);
    }

    public static ToolResult budgetExceeded(String toolName) {
        return new ToolResult(toolName, ToolResultStatus.BUDGET_EXCEEDED, Map.of(), "Time budget exceeded", 0);
    }

    public static ToolResult skipped(String toolName, int maxPerRound) {
        return new ToolResult(toolName, ToolResultStatus.SKIPPED, Map.of(),
                "Not executed: at most " + maxPerRound + " tool calls per round", 0);
    }

    public boolean isOk() {
        return status == ToolResultStatus.OK;
    }

    /** The map the model sees as the tool's response. */
    public Map<String, Object> envelope() {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("status", status.name().toLowerCase(Locale.ROOT));
        if (isOk()) {
            envelope.put("result", data);
        } else {
            envelope.put("error", error);
        }
        return envelope;
    }
}
