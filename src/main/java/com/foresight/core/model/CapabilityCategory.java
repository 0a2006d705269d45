package com.foresight.core.model;

/**
 * Top-level split of host capabilities: read-only DATA lookups versus mutating ACTIONs.
 */
public enum CapabilityCategory {
    DATA,
    ACTION
}
