package com.foresight.dispatch.api;

import com.foresight.core.model.DecisionResult.RejectedDecision;
import com.foresight.core.model.Recommendation;

import java.util.List;

/**
 * Response body for POST /api/v1/actions/decide.
 */
public record DecideResponse(int processed, List<Recommendation> accepted, List<RejectedDecision> rejected) {}
