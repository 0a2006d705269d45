package com.foresight.mcp;

import com.foresight.core.host.Capability;
import com.foresight.core.host.CapabilityResult;
import com.foresight.core.llm.LlmService;
import org.springframework.ai.tool.ToolCallback;

/**
 * One MCP tool exposed as a host capability named {@code <server>:<tool>}.
 * <p>
 * MCP tools take structured arguments while capabilities are triggered by a phrase,
 * so invocation lets the model turn the phrase into a single tool call and report on it.
 */
class McpToolCapability implements Capability {

    static final double TEMPERATURE = 0.1;

    private static final String SYSTEM_PROMPT = """
            You execute one tool on behalf of an autonomous agent.
            Call the provided tool exactly once with arguments derived from the request.
            Then report whether it succeeded and summarize what it returned.
            Do not invent results; if the tool fails, report the failure.
            """;

    private final String server;
    private final ToolCallback tool;
    private final LlmService llmService;

    McpToolCapability(String server, ToolCallback tool, LlmService llmService) {
        this.server = server;
        this.tool = tool;
        this.llmService = llmService;
    }

    @Override
    public String name() {
        return server + ":" + tool.getToolDefinition().name();
    }

    @Override
    public String description() {
        String description = tool.getToolDefinition().description();
        return description != null ? description : "";
    }

    @Override
    public String owner() {
        return server;
    }

    @Override
    public CapabilityResult invoke(String trigger) {
        var report = llmService.structuredCallWithTools(SYSTEM_PROMPT, "Request: " + trigger,
                ToolInvocationReport.class, TEMPERATURE, tool);
        if (!report.success()) {
            return CapabilityResult.failure(report.error() != null && !report.error().isBlank()
                    ? report.error() : "Tool " + name() + " reported failure");
        }
        return CapabilityResult.success(report.summary(), report);
    }
}
