package com.atlas.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed vocabulary for the expected wall-clock effort of a plan.
 */
public enum Effort {
    /** Under five minutes. */
    QUICK,
    /** Five to fifteen minutes. */
    MEDIUM,
    /** Fifteen minutes or more. */
    SUBSTANTIAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<Effort> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values()).filter(e -> e.name().equalsIgnoreCase(normalized)).findFirst();
    }
}
