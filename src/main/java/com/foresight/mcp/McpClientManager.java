package com.foresight.mcp;

import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Owns one MCP sync client per configured server.
 * <p>
 * Clients are created lazily and cached. A server that cannot be reached is not
 * retried until {@link #RETRY_BACKOFF} has passed, so callers enumerating capabilities
 * do not stall on repeated connection attempts.
 */
@Component
public class McpClientManager {

    private static final Logger log = LoggerFactory.getLogger(McpClientManager.class);

    static final Duration RETRY_BACKOFF = Duration.ofSeconds(60);

    private final McpProperties props;
    private final Function<McpProperties.ServerConfig, McpSyncClient> connector;
    private final Clock clock;
    private final Map<String, McpSyncClient> clients = new ConcurrentHashMap<>();
    private final Map<String, Instant> failedAt = new ConcurrentHashMap<>();

    @Autowired
    public McpClientManager(McpProperties props) {
        this(props, McpClientManager::connect, Clock.systemUTC());
    }

    McpClientManager(McpProperties props, Function<McpProperties.ServerConfig, McpSyncClient> connector,
                     Clock clock) {
        this.props = props;
        this.connector = connector;
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        if (!props.isConfigured()) {
            log.info("MCP servers disabled or not configured");
            return;
        }
        for (String server : props.getServers().keySet()) {
            var client = getClientFor(server);
            if (client == null) continue;
            try {
                var tools = client.listTools();
                int count = tools.tools() != null ? tools.tools().size() : 0;
                log.info("MCP server '{}' connected, {} tool(s) available", server, count);
            } catch (Exception e) {
                log.warn("MCP server '{}' startup check failed: {}", server, e.getMessage());
            }
        }
    }

    /**
     * @return the client for the named server, or {@code null} if it is not configured,
     *         unreachable, or still backing off after a failed attempt
     */
    public McpSyncClient getClientFor(String server) {
        if (!props.isConfigured()) return null;
        var config = props.getServers().get(server);
        if (config == null || !config.hasUrl()) return null;

        var existing = clients.get(server);
        if (existing != null) return existing;

        var lastFailure = failedAt.get(server);
        if (lastFailure != null && clock.instant().isBefore(lastFailure.plus(RETRY_BACKOFF))) {
            return null;
        }

        return clients.computeIfAbsent(server, key -> {
            try {
                var client = connector.apply(config);
                failedAt.remove(server);
                log.info("MCP client created for server '{}'", server);
                return client;
            } catch (Exception e) {
                failedAt.put(server, clock.instant());
                log.warn("Failed to create MCP client for server '{}', retrying after {}s: {}",
                        server, RETRY_BACKOFF.toSeconds(), e.getMessage());
                return null;
            }
        });
    }

    private static McpSyncClient connect(McpProperties.ServerConfig config) {
        var transportBuilder = HttpClientStreamableHttpTransport.builder(config.getUrl());
        String token = config.getToken();
        if (token != null && !token.isBlank()) {
            transportBuilder.customizeRequest(req -> req.header("Authorization", "Bearer " + token));
        }
        var client = McpClient.sync(transportBuilder.build())
                .requestTimeout(Duration.ofSeconds(30))
                .build();
        client.initialize();
        return client;
    }

    /**
     * Clients for every configured server that could be reached, keyed by server name.
     */
    public Map<String, McpSyncClient> connectedClients() {
        var connected = new LinkedHashMap<String, McpSyncClient>();
        if (!props.isConfigured()) return connected;
        for (String server : props.getServers().keySet()) {
            var client = getClientFor(server);
            if (client != null) connected.put(server, client);
        }
        return connected;
    }

    /**
     * Clients created so far, without attempting new connections.
     */
    public Map<String, McpSyncClient> getClients() {
        return Collections.unmodifiableMap(clients);
    }

    public boolean isConfigured() {
        return props.isConfigured();
    }

    @PreDestroy
    void shutdown() {
        for (var entry : clients.entrySet()) {
            try {
                entry.getValue().close();
                log.info("MCP client disconnected (server: {})", entry.getKey());
            } catch (Exception e) {
                log.debug("Error closing MCP client '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        clients.clear();
    }
}
