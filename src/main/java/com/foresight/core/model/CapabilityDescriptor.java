package com.foresight.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Serializable metadata of a host capability.
 * <p>
 * Descriptors travel through the analysis graph; the capability handler itself
 * stays inside the host environment and is reached by {@link #name()}.
 */
public record CapabilityDescriptor(
    String name,
    String description,
    List<String> similes,
    List<ExampleExchange> examples,
    String owner
) implements Serializable {

    public CapabilityDescriptor {
        similes = similes == null ? List.of() : List.copyOf(similes);
        examples = examples == null ? List.of() : List.copyOf(examples);
    }

    public static CapabilityDescriptor of(String name, String description) {
        return new CapabilityDescriptor(name, description, List.of(), List.of(), null);
    }

    /**
     * Owning provider: explicit owner, else the {@code owner:} prefix of the name, else "unknown".
     */
    public String ownerName() {
        if (owner != null && !owner.isBlank()) {
            return owner;
        }
        return ownerPrefix(name);
    }

    public static String ownerPrefix(String capabilityName) {
        if (capabilityName != null) {
            int colon = capabilityName.indexOf(':');
            if (colon > 0) {
                return capabilityName.substring(0, colon);
            }
        }
        return "unknown";
    }
}
