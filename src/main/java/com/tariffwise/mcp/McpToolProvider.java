package com.tariffwise.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tariffwise.core.tools.ToolRegistry;
import io.modelcontextprotocol.client.McpSyncClient;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.mcp.SyncMcpToolCallbackProvider;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Discovers tools on the configured MCP servers at startup and registers them in the
 * {@link ToolRegistry}. A remote tool whose name clashes with a registered one is skipped.
 */
@Component
public class McpToolProvider {

    private static final Logger log = LoggerFactory.getLogger(McpToolProvider.class);

    private final McpClientManager clientManager;
    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;

    public McpToolProvider(McpClientManager clientManager, ToolRegistry toolRegistry, ObjectMapper objectMapper) {
        this.clientManager = clientManager;
        this.toolRegistry = toolRegistry;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    void registerRemoteTools() {
        if (!clientManager.isConfigured()) {
            return;
        }
        int registered = 0;
        for (Map.Entry<String, McpSyncClient> entry : clientManager.connectAll().entrySet()) {
            registered += registerServer(entry.getKey(), entry.getValue());
        }
        log.info("Registered {} remote MCP tool(s)", registered);
    }

    int registerServer(String server, McpSyncClient client) {
        ToolCallback[] callbacks;
        try {
            callbacks = new SyncMcpToolCallbackProvider(List.of(client)).getToolCallbacks();
        } catch (RuntimeException e) {
            log.warn("Failed to discover MCP tools on '{}': {}", server, e.getMessage());
            return 0;
        }
        int registered = 0;
        for (ToolCallback callback : callbacks) {
            var tool = new McpClassificationTool(server, callback, objectMapper);
            try {
                toolRegistry.register(tool);
                registered++;
                log.info("  MCP tool: {} ({})", tool.name(), server);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping MCP tool from '{}': {}", server, e.getMessage());
            }
        }
        return registered;
    }
}
