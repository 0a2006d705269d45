package com.foresight.core.model;

import java.io.Serializable;
import java.util.Locale;

/**
 * Result of classifying one capability as DATA or ACTION.
 *
 * @param capabilityName the classified capability
 * @param category       DATA or ACTION
 * @param subType        sub-type drawn from the category's vocabulary, OTHER when unknown
 * @param confidence     model confidence, clamped to [0, 1]
 * @param reasoning      short model explanation
 * @param ownerName      provider owning the capability
 */
public record CapabilityClassification(
    String capabilityName,
    CapabilityCategory category,
    String subType,
    double confidence,
    String reasoning,
    String ownerName
) implements Serializable {

    public static final String OTHER = "OTHER";

    public CapabilityClassification {
        subType = subType == null || subType.isBlank() ? OTHER : subType.trim().toUpperCase(Locale.ROOT);
        confidence = clamp(confidence);
        reasoning = reasoning == null ? "" : reasoning;
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
