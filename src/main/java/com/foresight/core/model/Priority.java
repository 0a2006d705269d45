package com.foresight.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Recommendation priority. The ordinal is what gets stored and sorted on.
 */
public enum Priority {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int ordinalValue;

    Priority(int ordinalValue) {
        this.ordinalValue = ordinalValue;
    }

    public int ordinalValue() {
        return ordinalValue;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse; anything unrecognised is treated as medium.
     */
    @JsonCreator
    public static Priority fromValue(String value) {
        if (value != null) {
            for (Priority p : values()) {
                if (p.name().equalsIgnoreCase(value.trim())) {
                    return p;
                }
            }
        }
        return MEDIUM;
    }

    public static Priority fromOrdinalValue(int ordinalValue) {
        for (Priority p : values()) {
            if (p.ordinalValue == ordinalValue) {
                return p;
            }
        }
        return MEDIUM;
    }
}
