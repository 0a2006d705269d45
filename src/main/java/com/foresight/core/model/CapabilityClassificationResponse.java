package com.foresight.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Structured model output for classifying one capability.
 */
public record CapabilityClassificationResponse(
    @JsonPropertyDescription("DATA for read-only lookups, ACTION for operations that change state")
    String category,
    @JsonPropertyDescription("Sub-type from the vocabulary of the chosen category")
    String subType,
    @JsonPropertyDescription("Confidence between 0 and 1")
    double confidence,
    @JsonPropertyDescription("One sentence explaining the classification")
    String reasoning
) {}
