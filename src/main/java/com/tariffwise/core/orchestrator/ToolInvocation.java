package com.tariffwise.core.orchestrator;

import com.tariffwise.core.tools.ToolResult;

/**
 * One tool call made during a round and its result (success or error envelope).
 */
public record ToolInvocation(
    String callId,
    String toolName,
    String arguments,
    ToolResult result,
    long durationMs
) {}
