package com.foresight.mcp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class McpPropertiesTest {

    private static McpProperties.ServerConfig server(String url) {
        var config = new McpProperties.ServerConfig();
        config.setUrl(url);
        return config;
    }

    @Test
    @DisplayName("disabled by default")
    void defaults() {
        var props = new McpProperties();
        assertFalse(props.isEnabled());
        assertFalse(props.isConfigured());
    }

    @Test
    @DisplayName("configured only when enabled with at least one server URL")
    void configured() {
        var props = new McpProperties();
        props.setServers(Map.of("market", server("")));
        props.setEnabled(true);
        assertFalse(props.isConfigured());

        props.setServers(Map.of("market", server("https://mcp.example.com/mcp")));
        assertTrue(props.isConfigured());

        props.setEnabled(false);
        assertFalse(props.isConfigured());
    }

    @Test
    @DisplayName("capability source is empty when MCP is not configured")
    void sourceEmptyWhenUnconfigured() {
        var manager = mock(McpClientManager.class);
        when(manager.isConfigured()).thenReturn(false);

        var source = new McpCapabilitySource(manager, null);

        assertEquals("mcp", source.name());
        assertTrue(source.capabilities().isEmpty());
        verify(manager, never()).connectedClients();
    }
}
