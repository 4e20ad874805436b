package com.tariffwise.mcp;

import io.modelcontextprotocol.client.McpSyncClient;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Actuator health indicator for MCP server connections. Pings every connected server.
 */
@Component
@ConditionalOnProperty(prefix = "tariffwise.mcp", name = "enabled", havingValue = "true")
public class McpHealthIndicator implements HealthIndicator {

    private final McpClientManager clientManager;
    private final McpProperties props;

    public McpHealthIndicator(McpClientManager clientManager, McpProperties props) {
        this.clientManager = clientManager;
        this.props = props;
    }

    @Override
    public Health health() {
        if (!clientManager.isConfigured()) {
            return Health.unknown().withDetail("reason", "not configured").build();
        }

        Map<String, McpSyncClient> clients = clientManager.getClients();
        var builder = Health.up();
        boolean anyDown = false;
        for (var entry : props.getServers().entrySet()) {
            if (!entry.getValue().hasUrl()) {
                continue;
            }
            McpSyncClient client = clients.get(entry.getKey());
            if (client == null) {
                builder.withDetail(entry.getKey(), "DOWN: not connected");
                anyDown = true;
                continue;
            }
            try {
                client.ping();
                builder.withDetail(entry.getKey(), "UP");
            } catch (RuntimeException e) {
                builder.withDetail(entry.getKey(), "DOWN: " + e.getMessage());
                anyDown = true;
            }
        }
        return anyDown ? builder.status("DEGRADED").build() : builder.build();
    }
}
