package com.tariffwise.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tariffwise.core.tools.ClassificationTool;
import com.tariffwise.core.tools.RequestScope;
import com.tariffwise.core.tools.ToolArguments;
import org.springframework.ai.tool.ToolCallback;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exposes a remote MCP tool through the {@link ClassificationTool} contract, so the dispatcher
 * treats it like a local one.
 */
public class McpClassificationTool implements ClassificationTool {

    private final String server;
    private final ToolCallback callback;
    private final ObjectMapper objectMapper;

    public McpClassificationTool(String server, ToolCallback callback, ObjectMapper objectMapper) {
        this.server = server;
        this.callback = callback;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return callback.getToolDefinition().name();
    }

    @Override
    public String description() {
        return callback.getToolDefinition().description();
    }

    @Override
    public String inputSchema() {
        return callback.getToolDefinition().inputSchema();
    }

    public String server() {
        return server;
    }

    @Override
    public Map<String, Object> invoke(ToolArguments arguments, RequestScope scope) {
        String input;
        try {
            input = objectMapper.writeValueAsString(arguments.asMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize arguments for " + name(), e);
        }
        String output = callback.call(input);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("server", server);
        result.put("result", readOutput(output));
        return result;
    }

    /** Structured JSON when the server returned JSON, otherwise the raw text. */
    private Object readOutput(String output) {
        if (output == null) {
            return "";
        }
        try {
            JsonNode node = objectMapper.readTree(output);
            return node != null ? node : output;
        } catch (JsonProcessingException e) {
            return output;
        }
    }
}
