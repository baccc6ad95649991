package com.atlas.core.model;

import java.util.Objects;

/**
 * Result of classifying a single inbound message.
 *
 * @param intent            the detected intent, never null
 * @param confidence        how strongly the message matched
 * @param shouldExecuteTask true only for {@link IntentType#TASK}
 * @param suggestedResponse canned reply for conversational messages, null for tasks
 * @param reasoning         short human-readable explanation of the match
 */
public record ClassificationResult(
    IntentType intent,
    Confidence confidence,
    boolean shouldExecuteTask,
    String suggestedResponse,
    String reasoning
) {
    public ClassificationResult {
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(confidence, "confidence");
    }

    public static ClassificationResult conversational(IntentType intent, Confidence confidence,
                                                      String suggestedResponse, String reasoning) {
        return new ClassificationResult(intent, confidence, false, suggestedResponse, reasoning);
    }

    public static ClassificationResult task(Confidence confidence, String reasoning) {
        return new ClassificationResult(IntentType.TASK, confidence, true, null, reasoning);
    }
}
