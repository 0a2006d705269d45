package com.foresight.core.model;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Capabilities grouped by sub-type within each category, plus the raw classifications.
 */
public record ClassifiedCapabilities(
    Map<String, List<CapabilityDescriptor>> dataByType,
    Map<String, List<CapabilityDescriptor>> actionByType,
    List<CapabilityClassification> classifications
) implements Serializable {

    public ClassifiedCapabilities {
        dataByType = copy(dataByType);
        actionByType = copy(actionByType);
        classifications = classifications == null ? List.of() : List.copyOf(classifications);
    }

    public static ClassifiedCapabilities empty() {
        return new ClassifiedCapabilities(Map.of(), Map.of(), List.of());
    }

    public int dataCount() {
        return dataByType.values().stream().mapToInt(List::size).sum();
    }

    public int actionCount() {
        return actionByType.values().stream().mapToInt(List::size).sum();
    }

    private static Map<String, List<CapabilityDescriptor>> copy(Map<String, List<CapabilityDescriptor>> source) {
        var result = new LinkedHashMap<String, List<CapabilityDescriptor>>();
        if (source != null) {
            source.forEach((type, caps) -> result.put(type, List.copyOf(caps)));
        }
        return result;
    }
}
