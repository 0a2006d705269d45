package com.foresight.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.util.List;

/**
 * Structured model output describing one recommended action.
 */
public record RecommendationDraft(
    @JsonPropertyDescription("Name of the capability to invoke")
    String capabilityType,
    @JsonPropertyDescription("Provider that owns the capability")
    String ownerName,
    @JsonPropertyDescription("high, medium or low")
    String priority,
    @JsonPropertyDescription("Why this action is recommended now")
    String reasoning,
    @JsonPropertyDescription("Confidence between 0 and 1")
    double confidence,
    @JsonPropertyDescription("Natural-language message that would trigger the capability, including concrete amounts")
    String triggerPhrase,
    @JsonPropertyDescription("Parameters for the action as key/value pairs")
    List<Param> params,
    @JsonPropertyDescription("Expected impact of executing the action")
    String estimatedImpact,
    @JsonPropertyDescription("Estimated gas or fee cost, if applicable")
    String estimatedGas
) {

    public RecommendationDraft {
        params = params == null ? List.of() : params;
    }

    public record Param(String key, String value) {}
}
