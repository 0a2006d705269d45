package com.foresight.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why a recommendation's execution failed.
 * INITIALIZATION means the capability could not be located; EXECUTION means it ran and failed.
 */
public enum ErrorKind {
    INITIALIZATION,
    EXECUTION;

    /**
     * Classifies an arbitrary failure message.
     */
    public static ErrorKind fromMessage(String message) {
        if (message != null && message.toLowerCase(Locale.ROOT).contains("not found")) {
            return INITIALIZATION;
        }
        return EXECUTION;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ErrorKind fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
