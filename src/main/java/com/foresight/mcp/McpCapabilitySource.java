package com.foresight.mcp;

import com.foresight.core.host.Capability;
import com.foresight.core.host.CapabilitySource;
import com.foresight.core.llm.LlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.mcp.SyncMcpToolCallbackProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exposes the tools of every connected MCP server as capabilities.
 * Tool lists are discovered once per server and cached.
 */
@Component
public class McpCapabilitySource implements CapabilitySource {

    private static final Logger log = LoggerFactory.getLogger(McpCapabilitySource.class);

    private final McpClientManager clientManager;
    private final LlmService llmService;
    private final Map<String, List<Capability>> discovered = new ConcurrentHashMap<>();

    public McpCapabilitySource(McpClientManager clientManager, LlmService llmService) {
        this.clientManager = clientManager;
        this.llmService = llmService;
    }

    @Override
    public String name() {
        return "mcp";
    }

    @Override
    public List<Capability> capabilities() {
        if (!clientManager.isConfigured()) {
            return List.of();
        }
        var all = new ArrayList<Capability>();
        for (var entry : clientManager.connectedClients().entrySet()) {
            String server = entry.getKey();
            var tools = discovered.get(server);
            if (tools == null) {
                try {
                    var callbacks = new SyncMcpToolCallbackProvider(List.of(entry.getValue())).getToolCallbacks();
                    var capabilities = new ArrayList<Capability>();
                    for (var callback : callbacks) {
                        capabilities.add(new McpToolCapability(server, callback, llmService));
                    }
                    tools = List.copyOf(capabilities);
                    discovered.put(server, tools);
                    log.info("Discovered {} MCP tool(s) on server '{}'", tools.size(), server);
                } catch (Exception e) {
                    log.warn("Failed to discover MCP tools on server '{}': {}", server, e.getMessage());
                    continue;
                }
            }
            all.addAll(tools);
        }
        return all;
    }
}
