package com.atlas.core.context;

import com.atlas.core.model.ConversationMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Pattern-based summary of a conversation that needs no model call. Only
 * messages that report a completion, an error or a result are kept.
 */
public final class QuickSummarizer {

    public static final int DEFAULT_MAX_LENGTH = 500;
    static final String EMPTY_SUMMARY = "Previous conversation context available.";

    private static final int EXCERPT_CHARS = 100;

    private QuickSummarizer() {}

    public static String summarize(List<ConversationMessage> messages) {
        return summarize(messages, DEFAULT_MAX_LENGTH);
    }

    public static String summarize(List<ConversationMessage> messages, int maxLength) {
        var important = new ArrayList<String>();
        for (ConversationMessage msg : messages) {
            String lower = msg.content().toLowerCase();
            String excerpt = excerpt(msg.content());
            if (lower.contains("task complete") || lower.contains("completed")) {
                important.add("✅ Completed: " + excerpt);
            } else if (lower.contains("error") || lower.contains("failed")) {
                important.add("❌ Error: " + excerpt);
            } else if (lower.contains("found") || lower.contains("created")) {
                important.add("📊 Result: " + excerpt);
            }
        }

        String summary = String.join("\n", important);
        if (summary.length() > maxLength) {
            summary = summary.substring(0, maxLength) + "...";
        }
        return summary.isEmpty() ? EMPTY_SUMMARY : summary;
    }

    private static String excerpt(String content) {
        return content.length() <= EXCERPT_CHARS ? content : content.substring(0, EXCERPT_CHARS);
    }
}
