package com.foresight.mcp;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * What the model reports after calling an MCP tool on behalf of a trigger phrase.
 */
public record ToolInvocationReport(
    @JsonPropertyDescription("true if the tool was called and returned a usable result")
    boolean success,
    @JsonPropertyDescription("Concise summary of what the tool returned")
    String summary,
    @JsonPropertyDescription("Why the call failed, if it did")
    String error
) {}
