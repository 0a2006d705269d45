package com.foresight.core.host;

import com.foresight.core.model.CapabilityDescriptor;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The agent runtime the pipeline analyses and acts through.
 * <p>
 * Execution contexts form a two-level tree: one durable world per agent
 * (created with a {@code null} parent) and short-lived rooms nested inside it.
 */
public interface HostEnvironment {

    /**
     * Enumerates the capabilities available right now.
     */
    List<CapabilityDescriptor> capabilities();

    Optional<CapabilityDescriptor> findCapability(String name);

    /**
     * Queries every registered context provider. Provider failures are logged and
     * the provider is left out of the result.
     *
     * @return provider name to payload
     */
    Map<String, Object> composeContext();

    /**
     * Invokes the named capability with the trigger text and waits for it to finish.
     * The result is written to the {@link ResultRegistry} under {@code correlationId}.
     *
     * @throws CapabilityNotFoundException if no capability has that name
     */
    void dispatch(String correlationId, String triggerText, String capabilityName);

    void ensureExecutionContext(String id, String parentWorldId);

    boolean executionContextExists(String id);

    void deleteExecutionContext(String id);
}
