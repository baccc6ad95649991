package com.atlas.core.context;

import com.atlas.core.model.ConversationMessage;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide cache of conversation summaries keyed by a fingerprint of the
 * summarized span.
 * <p>
 * The fingerprint only looks at the first 50 characters of the first and last
 * message plus the message count, so two different histories that agree on
 * those will share a summary. Entries are never evicted; call {@link #clear()}
 * to reset. Concurrent writers for the same key are allowed and the last write
 * wins.
 */
@Component
public class SummaryCache {

    private static final int FINGERPRINT_CHARS = 50;

    private final Map<String, String> summaries = new ConcurrentHashMap<>();

    public Optional<String> get(List<ConversationMessage> summarized) {
        return Optional.ofNullable(summaries.get(fingerprint(summarized)));
    }

    public void put(List<ConversationMessage> summarized, String summary) {
        summaries.put(fingerprint(summarized), summary);
    }

    public void clear() {
        summaries.clear();
    }

    public int size() {
        return summaries.size();
    }

    static String fingerprint(List<ConversationMessage> messages) {
        String first = messages.isEmpty() ? "" : head(messages.get(0).content());
        String last = messages.isEmpty() ? "" : head(messages.get(messages.size() - 1).content());
        return first + "|" + last + "|" + messages.size();
    }

    private static String head(String content) {
        return content.length() <= FINGERPRINT_CHARS ? content : content.substring(0, FINGERPRINT_CHARS);
    }
}
