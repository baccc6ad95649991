package com.atlas.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed vocabulary describing how hard a task is.
 */
public enum Complexity {
    /** 1-3 steps, single focus. */
    SIMPLE,
    /** 3-5 steps, clear path. */
    MODERATE,
    /** 5-8 steps, multiple concerns. */
    COMPLEX,
    /** Unknown scope, requires discovery. */
    EXPLORATORY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<Complexity> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values()).filter(c -> c.name().equalsIgnoreCase(normalized)).findFirst();
    }
}
