package com.foresight.core.host;

/**
 * A source of ambient situational data, such as current holdings or the time of day.
 */
public interface ContextProvider {

    String name();

    /**
     * Returns the provider's current payload. Must be serializable.
     */
    Object provide();
}
