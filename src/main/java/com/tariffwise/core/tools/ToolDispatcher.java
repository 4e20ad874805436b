package com.tariffwise.core.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tariffwise.core.concurrent.BoundedCallExecutor;
import com.tariffwise.core.llm.ToolSpec;
import com.tariffwise.core.metrics.ClassificationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Executes named tools for one request.
 * <p>
 * Every outcome, including unknown names, invalid arguments, tool exceptions and timeouts, is
 * returned as a {@link ToolResult}; nothing is thrown to the caller. Created per request by
 * {@link ToolRegistry#dispatcherFor(RequestScope)}.
 */
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final Map<String, ClassificationTool> tools;
    private final RequestScope scope;
    private final BoundedCallExecutor executor;
    private final ObjectMapper objectMapper;
    private final ClassificationMetrics metrics;
    private final Duration defaultTimeout;
    private final Map<String, Integer> invocationCounts = new LinkedHashMap<>();

    public ToolDispatcher(Map<String, ClassificationTool> tools, RequestScope scope, BoundedCallExecutor executor,
                          ObjectMapper objectMapper, ClassificationMetrics metrics, Duration defaultTimeout) {
        this.tools = Map.copyOf(tools);
        this.scope = scope;
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.defaultTimeout = defaultTimeout;
    }

    public ToolResult execute(String toolName, String argumentsJson) {
        return execute(toolName, argumentsJson, defaultTimeout);
    }

    /**
     * Runs one tool, waiting at most {@code timeout} for it.
     */
    public ToolResult execute(String toolName, String argumentsJson, Duration timeout) {
        ClassificationTool tool = toolName == null ? null : tools.get(toolName);
        if (tool == null) {
            log.warn("Model requested unknown tool '{}'", toolName);
            record(String.valueOf(toolName), ToolResultStatus.NOT_FOUND, 0);
            return ToolResult.notFound(toolName);
        }
        synchronized (invocationCounts) {
            invocationCounts.merge(toolName, 1, Integer::sum);
        }

        long start = System.currentTimeMillis();
        ToolResult result;
        try {
            ToolArguments arguments = ToolArguments.parse(argumentsJson, objectMapper);
            Map<String, Object> data = executor.call(() -> tool.invoke(arguments, scope), timeout);
            result = ToolResult.ok(toolName, data, elapsedSince(start));
        } catch (ToolArgumentException e) {
            result = ToolResult.invalidArguments(toolName, e.getMessage());
        } catch (TimeoutException e) {
            result = ToolResult.error(toolName, "Tool timed out after " + timeout.toMillis() + "ms", elapsedSince(start));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ToolArgumentException) {
                result = ToolResult.invalidArguments(toolName, cause.getMessage());
            } else {
                log.warn("Tool '{}' failed: {}", toolName, cause.getMessage(), cause);
                result = ToolResult.error(toolName, describe(cause), elapsedSince(start));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = ToolResult.error(toolName, "Tool call interrupted", elapsedSince(start));
        } catch (RuntimeException e) {
            log.warn("Tool '{}' could not be started: {}", toolName, e.getMessage());
            result = ToolResult.error(toolName, describe(e), elapsedSince(start));
        }

        log.info("Tool '{}' -> {} ({}ms)", toolName, result.status(), result.durationMs());
        log.debug("Tool '{}' arguments {} result {}", toolName, argumentsJson, result.envelope());
        record(toolName, result.status(), result.durationMs());
        return result;
    }

    /** Serializes the result envelope for the transcript. */
    public String toJson(ToolResult result) {
        try {
            return objectMapper.writeValueAsString(result.envelope());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize result of tool '{}': {}", result.toolName(), e.getMessage());
            return "{\"status\":\"error\",\"error\":\"Tool result could not be serialized\"}";
        }
    }

    public List<ToolSpec> toolSpecs() {
        return tools.values().stream()
                .sorted(Comparator.comparing(ClassificationTool::name))
                .map(t -> new ToolSpec(t.name(), t.description(), t.inputSchema()))
                .toList();
    }

    public Map<String, Integer> invocationCounts() {
        synchronized (invocationCounts) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(invocationCounts));
        }
    }

    public RequestScope scope() {
        return scope;
    }

    private void record(String toolName, ToolResultStatus status, long ms) {
        if (metrics != null) {
            metrics.recordToolInvocation(toolName, status.name(), ms);
        }
    }

    private static long elapsedSince(long start) {
        return System.currentTimeMillis() - start;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
