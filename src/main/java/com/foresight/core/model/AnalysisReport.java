package com.foresight.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * An analysis together with the recommendations generated from it.
 */
public record AnalysisReport(Analysis analysis, List<Recommendation> recommendations) implements Serializable {

    public AnalysisReport {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
