package com.atlas.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What an inbound message is asking for. Everything that is not recognised
 * as conversational chatter is a {@link #TASK}.
 */
public enum IntentType {
    GREETING("greeting"),
    FAREWELL("farewell"),
    GRATITUDE("gratitude"),
    AFFIRMATION("affirmation"),
    NEGATION("negation"),
    SMALL_TALK("small_talk"),
    AGENT_QUESTION("agent_question"),
    CLARIFICATION("clarification"),
    TASK("task");

    private final String wireName;

    IntentType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
