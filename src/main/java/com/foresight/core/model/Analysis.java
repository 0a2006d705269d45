package com.foresight.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A persisted analysis run. Immutable once saved.
 *
 * @param id               analysis UUID
 * @param agentId          agent the analysis was produced for
 * @param createdAt        creation time
 * @param sections         the narrative
 * @param capabilitiesUsed de-duplicated capability owners and context providers that contributed
 * @param executionTimeMs  wall-clock duration of the run
 */
public record Analysis(
    String id,
    String agentId,
    Instant createdAt,
    AnalysisSections sections,
    List<String> capabilitiesUsed,
    long executionTimeMs
) implements Serializable {

    public Analysis {
        capabilitiesUsed = capabilitiesUsed == null ? List.of() : List.copyOf(capabilitiesUsed);
    }
}
