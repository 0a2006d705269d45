package com.foresight.core.persistence;

public class RecommendationNotFoundException extends RuntimeException {

    private final String recommendationId;

    public RecommendationNotFoundException(String recommendationId) {
        super("Action not found: " + recommendationId);
        this.recommendationId = recommendationId;
    }

    public String getRecommendationId() {
        return recommendationId;
    }
}
