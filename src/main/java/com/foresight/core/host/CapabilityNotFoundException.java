package com.foresight.core.host;

/**
 * Thrown when a capability name cannot be resolved in the host environment.
 */
public class CapabilityNotFoundException extends RuntimeException {

    private final String capabilityName;

    public CapabilityNotFoundException(String capabilityName) {
        super("Action " + capabilityName + " not found in host environment");
        this.capabilityName = capabilityName;
    }

    public String getCapabilityName() {
        return capabilityName;
    }
}
