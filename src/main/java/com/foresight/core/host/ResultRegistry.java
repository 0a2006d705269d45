package com.foresight.core.host;

import java.util.Optional;

/**
 * Holds capability results keyed by the correlation id of the dispatch that produced them.
 */
public interface ResultRegistry {

    void put(String correlationId, CapabilityResult result);

    Optional<CapabilityResult> get(String correlationId);

    void remove(String correlationId);
}
