package com.foresight.core.host;

/**
 * What a capability handler reports back to the host after running.
 */
public record CapabilityResult(boolean success, String text, Object data, String error) {

    public static CapabilityResult success(String text, Object data) {
        return new CapabilityResult(true, text, data, null);
    }

    public static CapabilityResult failure(String error) {
        return new CapabilityResult(false, null, null, error);
    }
}
