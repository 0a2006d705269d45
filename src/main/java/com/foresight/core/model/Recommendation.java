package com.foresight.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A generated suggestion to invoke one ACTION capability, subject to a human decision.
 * <p>
 * {@code decidedAt} is set once when the recommendation leaves {@code pending};
 * {@code executedAt} is set once when execution reaches a terminal status.
 */
public record Recommendation(
    String id,
    String analysisId,
    String capabilityType,
    String ownerName,
    Priority priority,
    String reasoning,
    double confidence,
    String triggerPhrase,
    Map<String, String> params,
    String estimatedImpact,
    String estimatedGas,
    RecommendationStatus status,
    Instant decidedAt,
    Instant executedAt,
    ExecutionOutcome result,
    String error,
    ErrorKind errorKind,
    Instant createdAt
) implements Serializable {

    public Recommendation {
        params = params == null ? Map.of() : Map.copyOf(params);
        confidence = CapabilityClassification.clamp(confidence);
        priority = priority == null ? Priority.MEDIUM : priority;
        status = status == null ? RecommendationStatus.PENDING : status;
    }

    public static Recommendation pending(String id, String analysisId, String capabilityType, String ownerName,
                                         Priority priority, String reasoning, double confidence,
                                         String triggerPhrase, Map<String, String> params,
                                         String estimatedImpact, String estimatedGas, Instant createdAt) {
        return new Recommendation(id, analysisId, capabilityType, ownerName, priority, reasoning, confidence,
                triggerPhrase, params, estimatedImpact, estimatedGas, RecommendationStatus.PENDING,
                null, null, null, null, null, createdAt);
    }

    public Recommendation rejected(Instant at) {
        return transition(RecommendationStatus.REJECTED, at, executedAt, result, error, errorKind);
    }

    public Recommendation executing(Instant at) {
        return transition(RecommendationStatus.EXECUTING, at, executedAt, result, error, errorKind);
    }

    public Recommendation completed(ExecutionOutcome outcome, Instant at) {
        return transition(RecommendationStatus.COMPLETED, decidedAt, at, outcome, null, null);
    }

    public Recommendation failed(String message, ErrorKind kind, Instant at) {
        return transition(RecommendationStatus.FAILED, decidedAt, at, null, message, kind);
    }

    private Recommendation transition(RecommendationStatus next, Instant decided, Instant executed,
                                      ExecutionOutcome outcome, String err, ErrorKind kind) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal status transition " + status.value() + " -> " + next.value()
                    + " for recommendation " + id);
        }
        return new Recommendation(id, analysisId, capabilityType, ownerName, priority, reasoning, confidence,
                triggerPhrase, params, estimatedImpact, estimatedGas, next, decided, executed, outcome, err, kind,
                createdAt);
    }

    /**
     * True when the record carries everything needed to be persisted and later executed.
     */
    @JsonIgnore
    public boolean isComplete() {
        return id != null && analysisId != null
                && capabilityType != null && !capabilityType.isBlank()
                && triggerPhrase != null && !triggerPhrase.isBlank();
    }
}
