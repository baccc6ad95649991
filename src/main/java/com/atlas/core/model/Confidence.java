package com.atlas.core.model;

/**
 * How sure the classifier is about an {@link IntentType}.
 */
public enum Confidence {
    HIGH,
    MEDIUM,
    LOW;

    public String wireName() {
        return name().toLowerCase();
    }
}
