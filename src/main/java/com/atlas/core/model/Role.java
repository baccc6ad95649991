package com.atlas.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Author of a {@link ConversationMessage}.
 */
public enum Role {
    USER,
    ASSISTANT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Role fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Role must not be null");
        }
        return Role.valueOf(value.trim().toUpperCase());
    }
}
