package com.foresight.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

import java.io.Serializable;

/**
 * The four narrative sections of an analysis.
 */
public record AnalysisSections(
    @JsonPropertyDescription("Overview of the agent's current position and holdings")
    String overview,
    @JsonPropertyDescription("Current market and environmental conditions relevant to the agent")
    String conditions,
    @JsonPropertyDescription("Assessment of risks and exposures")
    String risk,
    @JsonPropertyDescription("Opportunities worth acting on")
    String opportunities
) implements Serializable {

    public AnalysisSections {
        overview = overview == null ? "" : overview;
        conditions = conditions == null ? "" : conditions;
        risk = risk == null ? "" : risk;
        opportunities = opportunities == null ? "" : opportunities;
    }
}
