package com.tariffwise.core.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tariffwise.core.concurrent.BoundedCallExecutor;
import com.tariffwise.core.metrics.ClassificationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Process-wide registry mapping tool names to {@link ClassificationTool}s.
 * <p>
 * Built-in tools are registered at startup; remote tools may be added later. Duplicate names
 * are rejected. Requests get a {@link ToolDispatcher} over a snapshot of the registry.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ClassificationTool> tools = new LinkedHashMap<>();
    private final BoundedCallExecutor executor;
    private final ObjectMapper objectMapper;
    private final ClassificationMetrics metrics;
    private final Duration toolCallTimeout;

    public ToolRegistry(List<ClassificationTool> builtIns,
                        BoundedCallExecutor executor,
                        ObjectMapper objectMapper,
                        @Autowired(required = false) ClassificationMetrics metrics,
                        @Value("${tariffwise.orchestrator.tool-call-timeout:20s}") Duration toolCallTimeout) {
        this.executor = executor;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.toolCallTimeout = toolCallTimeout;
        builtIns.forEach(this::register);
        log.info("Tool registry initialized with {} tool(s): {}", tools.size(), tools.keySet());
    }

    /**
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public synchronized void register(ClassificationTool tool) {
        String name = tool.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank: " + tool.getClass().getName());
        }
        if (tools.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate tool name '" + name + "'");
        }
        tools.put(name, tool);
    }

    public synchronized Optional<ClassificationTool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public synchronized Set<String> names() {
        return new TreeSet<>(tools.keySet());
    }

    public synchronized int size() {
        return tools.size();
    }

    public ToolDispatcher dispatcherFor(RequestScope scope) {
        Map<String, ClassificationTool> snapshot;
        synchronized (this) {
            snapshot = new LinkedHashMap<>(tools);
        }
        return new ToolDispatcher(snapshot, scope, executor, objectMapper, metrics, toolCallTimeout);
    }
}
