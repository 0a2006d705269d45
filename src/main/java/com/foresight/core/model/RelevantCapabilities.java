package com.foresight.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.List;

/**
 * Structured model output naming the capabilities relevant to the current situation.
 */
public record RelevantCapabilities(
    @JsonPropertyDescription("Exact names of the relevant capabilities, possibly empty")
    List<String> relevantCapabilities,
    @JsonPropertyDescription("Why these capabilities were chosen")
    String reasoning
) {

    public RelevantCapabilities {
        relevantCapabilities = relevantCapabilities == null ? List.of() : relevantCapabilities;
    }
}
