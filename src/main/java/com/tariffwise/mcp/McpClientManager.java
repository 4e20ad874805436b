package com.tariffwise.mcp;

import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owns one MCP sync client per configured server.
 * <p>
 * Clients are connected by {@link #connectAll()}; a server that cannot be reached is logged
 * and left out, so the service still starts with its built-in tools.
 */
@Component
public class McpClientManager {

    private static final Logger log = LoggerFactory.getLogger(McpClientManager.class);

    private final McpProperties props;
    private final Map<String, McpSyncClient> clients = new LinkedHashMap<>();

    public McpClientManager(McpProperties props) {
        this.props = props;
    }

    /** Connects every configured server not yet connected. Returns server name to client. */
    public synchronized Map<String, McpSyncClient> connectAll() {
        if (!props.isConfigured()) {
            log.info("MCP servers disabled or not configured");
            return Map.of();
        }
        for (var entry : props.getServers().entrySet()) {
            String name = entry.getKey();
            var config = entry.getValue();
            if (!config.hasUrl() || clients.containsKey(name)) {
                continue;
            }
            try {
                clients.put(name, connect(name, config));
            } catch (RuntimeException e) {
                log.warn("MCP server '{}' at {} unavailable: {}", name, config.getUrl(), e.getMessage());
            }
        }
        return getClients();
    }

    private McpSyncClient connect(String name, McpProperties.ServerConfig config) {
        var transportBuilder = HttpClientSseClientTransport.builder(config.getUrl())
                .sseEndpoint(config.getSseEndpoint());
        String token = config.getToken();
        if (token != null && !token.isBlank()) {
            transportBuilder.customizeRequest(req -> req.header("Authorization", "Bearer " + token));
        }
        McpSyncClient client = McpClient.sync(transportBuilder.build())
                .requestTimeout(props.getRequestTimeout())
                .build();
        client.initialize();
        log.info("MCP server '{}' connected at {}", name, config.getUrl());
        return client;
    }

    public synchronized Map<String, McpSyncClient> getClients() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(clients));
    }

    public synchronized boolean hasClients() {
        return !clients.isEmpty();
    }

    public boolean isConfigured() {
        return props.isConfigured();
    }

    @PreDestroy
    synchronized void shutdown() {
        for (var entry : clients.entrySet()) {
            try {
                entry.getValue().close();
                log.info("MCP client disconnected (server: {})", entry.getKey());
            } catch (RuntimeException e) {
                log.debug("Error closing MCP client '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        clients.clear();
    }
}
