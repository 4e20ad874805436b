package com.tariffwise.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remote tool servers reached over MCP.
 *
 * <pre>
 * tariffwise:
 *   mcp:
 *     enabled: true
 *     servers:
 *       regulatory:
 *         url: https://regulatory.example.com
 *         token: secret
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "tariffwise.mcp")
public class McpProperties {

    private boolean enabled = false;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Map<String, ServerConfig> servers = new LinkedHashMap<>();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    public Map<String, ServerConfig> getServers() { return servers; }
    public void setServers(Map<String, ServerConfig> servers) { this.servers = servers; }

    /**
     * Returns {@code true} when MCP is enabled and at least one server has a URL.
     */
    public boolean isConfigured() {
        return enabled && servers.values().stream().anyMatch(ServerConfig::hasUrl);
    }

    public static class ServerConfig {
        private String url = "";
        private String sseEndpoint = "/sse";
        private String token = "";

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getSseEndpoint() { return sseEndpoint; }
        public void setSseEndpoint(String sseEndpoint) { this.sseEndpoint = sseEndpoint; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }

        public boolean hasUrl() {
            return url != null && !url.isBlank();
        }
    }
}
