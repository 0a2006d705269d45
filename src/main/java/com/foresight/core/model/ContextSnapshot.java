package com.foresight.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Payload reported by one context provider at collection time.
 */
public record ContextSnapshot(String providerName, Object data, Instant timestamp) implements Serializable {}
