package com.foresight.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a recommendation:
 * {@code pending -> rejected} or {@code pending -> executing -> completed | failed}.
 */
public enum RecommendationStatus {
    PENDING,
    REJECTED,
    EXECUTING,
    COMPLETED,
    FAILED;

    public boolean canTransitionTo(RecommendationStatus next) {
        return switch (this) {
            case PENDING -> next == REJECTED || next == EXECUTING;
            case EXECUTING -> next == COMPLETED || next == FAILED;
            case REJECTED, COMPLETED, FAILED -> false;
        };
    }

    public boolean isTerminal() {
        return Set.of(REJECTED, COMPLETED, FAILED).contains(this);
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RecommendationStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
