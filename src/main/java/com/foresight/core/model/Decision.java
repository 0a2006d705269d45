package com.foresight.core.model;

/**
 * A human verdict on one recommendation.
 */
public record Decision(String recommendationId, Verdict verdict) {}
