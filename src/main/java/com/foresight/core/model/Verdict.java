package com.foresight.core.model;

import java.util.Locale;
import java.util.Optional;

public enum Verdict {
    ACCEPT,
    REJECT;

    public static Optional<Verdict> parse(String value) {
        if (value == null) return Optional.empty();
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "accept" -> Optional.of(ACCEPT);
            case "reject" -> Optional.of(REJECT);
            default -> Optional.empty();
        };
    }
}
