package com.foresight.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Stored result payload of a completed recommendation.
 */
public record ExecutionOutcome(String text, Object data, Instant timestamp) implements Serializable {}
