package com.foresight.core.model;

import java.util.List;

/**
 * Breakdown of a processed decision batch. Decisions that failed appear in neither list.
 */
public record DecisionResult(List<Recommendation> accepted, List<RejectedDecision> rejected) {

    public DecisionResult {
        accepted = accepted == null ? List.of() : List.copyOf(accepted);
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }

    public record RejectedDecision(String actionId, String status) {}
}
