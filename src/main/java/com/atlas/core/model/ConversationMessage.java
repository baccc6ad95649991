package com.atlas.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One turn of a conversation.
 *
 * @param role      who wrote the message
 * @param content   message text, never null
 * @param timestamp when the message was sent, may be null
 */
public record ConversationMessage(
    Role role,
    String content,
    Instant timestamp
) {
    public ConversationMessage {
        Objects.requireNonNull(role, "role");
        content = content != null ? content : "";
    }

    public static ConversationMessage user(String content) {
        return new ConversationMessage(Role.USER, content, null);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(Role.ASSISTANT, content, null);
    }
}
