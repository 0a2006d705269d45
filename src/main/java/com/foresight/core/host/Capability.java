package com.foresight.core.host;

import com.foresight.core.model.CapabilityDescriptor;
import com.foresight.core.model.ExampleExchange;

import java.util.List;

/**
 * A named, invokable operation exposed by the host environment.
 * <p>
 * Implementations are either Spring beans registered in the application context or
 * capabilities discovered at runtime through a {@link CapabilitySource}. The pipeline
 * never calls {@link #invoke} directly; it dispatches by name through
 * {@link HostEnvironment#dispatch}.
 */
public interface Capability {

    String name();

    String description();

    default List<String> similes() {
        return List.of();
    }

    default List<ExampleExchange> examples() {
        return List.of();
    }

    /**
     * Owning provider, or {@code null} to derive it from the name prefix.
     */
    default String owner() {
        return null;
    }

    /**
     * Runs the capability for the given natural-language trigger.
     * A capability that fails in a controlled way returns {@link CapabilityResult#failure};
     * unexpected exceptions are recorded as failures by the host.
     */
    CapabilityResult invoke(String trigger);

    default CapabilityDescriptor describe() {
        return new CapabilityDescriptor(name(), description(), similes(), examples(), owner());
    }
}
