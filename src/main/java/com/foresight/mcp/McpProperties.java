package com.foresight.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remote MCP servers whose tools are exposed as host capabilities.
 *
 * <pre>
 * foresight:
 *   mcp:
 *     enabled: true
 *     servers:
 *       market:
 *         url: https://mcp.example.com/mcp
 *         token: secret
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "foresight.mcp")
public class McpProperties {

    private boolean enabled = false;
    private Map<String, ServerConfig> servers = new LinkedHashMap<>();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
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
        private String token = "";

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }

        public boolean hasUrl() {
            return url != null && !url.isBlank();
        }
    }
}
