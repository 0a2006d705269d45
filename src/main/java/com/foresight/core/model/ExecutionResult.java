package com.foresight.core.model;

import java.io.Serializable;

/**
 * Outcome of running one DATA capability during an analysis.
 * {@code data} is populated on success, {@code error} on failure.
 */
public record ExecutionResult(
    String capabilityName,
    boolean success,
    Object data,
    String error
) implements Serializable {

    public static ExecutionResult succeeded(String capabilityName, Object data) {
        return new ExecutionResult(capabilityName, true, data, null);
    }

    public static ExecutionResult failed(String capabilityName, String error) {
        return new ExecutionResult(capabilityName, false, null, error);
    }
}
