package com.atlas.core.context;

import com.atlas.core.llm.LlmProperties;
import com.atlas.core.llm.LlmService;
import com.atlas.core.metrics.AtlasMetrics;
import com.atlas.core.model.ConversationMessage;
import com.atlas.core.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Compresses older conversation turns into a single summary message while
 * keeping the most recent turns verbatim.
 * <p>
 * Summaries are reused through {@link SummaryCache}. When the model call fails
 * the older turns are truncated locally instead, so this never throws.
 */
@Service
public class ContextSummarizer {

    private static final Logger log = LoggerFactory.getLogger(ContextSummarizer.class);

    static final String SUMMARY_PROMPT = """
            Please provide a concise summary of this conversation, focusing on:
            1. Key topics discussed
            2. Important decisions made
            3. Tasks completed
            4. Current context/state

            Conversation:
            %s

            Summary (be concise but capture all important context):""";

    private static final int FALLBACK_EXCERPT_CHARS = 100;

    private final LlmService llmService;
    private final SummaryCache cache;
    private final LlmProperties llmProperties;
    private final SummarizerProperties properties;
    private final AtlasMetrics metrics;

    public ContextSummarizer(LlmService llmService, SummaryCache cache, LlmProperties llmProperties,
                             SummarizerProperties properties, AtlasMetrics metrics) {
        this.llmService = llmService;
        this.cache = cache;
        this.llmProperties = llmProperties;
        this.properties = properties;
        this.metrics = metrics;
    }

    public int keepRecent() {
        return properties.getKeepRecent();
    }

    public List<ConversationMessage> summarizeContext(List<ConversationMessage> messages) {
        return summarizeContext(messages, properties.getKeepRecent());
    }

    /**
     * Returns the history unchanged when it has at most {@code keepRecentCount}
     * messages; otherwise a summary message followed by the last
     * {@code keepRecentCount} messages. A negative count is treated as zero.
     */
    public List<ConversationMessage> summarizeContext(List<ConversationMessage> messages, int keepRecentCount) {
        if (keepRecentCount < 0) {
            log.warn("[Summarizer] Negative keep count {}, keeping no recent messages", keepRecentCount);
            keepRecentCount = 0;
        }
        if (messages.size() <= keepRecentCount) {
            log.info("[Summarizer] No summarization needed - message count within limit");
            return messages;
        }

        int split = messages.size() - keepRecentCount;
        List<ConversationMessage> old = messages.subList(0, split);
        List<ConversationMessage> recent = messages.subList(split, messages.size());

        String summary = cache.get(old).orElse(null);
        metrics.recordSummaryCacheLookup(summary != null);
        if (summary == null) {
            log.info("[Summarizer] Summarizing {} old messages...", old.size());
            summary = generateSummary(old);
            cache.put(old, summary);
        } else {
            log.info("[Summarizer] Using cached summary");
        }

        var result = new ArrayList<ConversationMessage>(recent.size() + 1);
        result.add(ConversationMessage.user("📝 CONVERSATION SUMMARY (" + old.size() + " messages):\n\n"
                + summary + "\n\n--- Recent messages below (full context) ---"));
        result.addAll(recent);
        return result;
    }

    public void clearCache() {
        cache.clear();
        log.info("[Summarizer] Cache cleared");
    }

    private String generateSummary(List<ConversationMessage> messages) {
        String conversation = messages.stream()
                .map(m -> (m.role() == Role.USER ? "User" : "Assistant") + ": " + m.content())
                .collect(Collectors.joining("\n\n"));
        try {
            String summary = llmService.call(null, SUMMARY_PROMPT.formatted(conversation),
                    llmProperties.getSummaryMaxTokens());
            log.info("[Summarizer] Generated summary ({} characters)", summary.length());
            return summary;
        } catch (Exception e) {
            log.error("[Summarizer] Failed to generate summary: {}", e.getMessage(), e);
            metrics.recordSummaryFallback();
            return truncate(messages);
        }
    }

    static String truncate(List<ConversationMessage> messages) {
        return messages.stream()
                .map(m -> m.role().wireName() + ": "
                        + (m.content().length() <= FALLBACK_EXCERPT_CHARS
                                ? m.content() : m.content().substring(0, FALLBACK_EXCERPT_CHARS))
                        + "...")
                .collect(Collectors.joining("\n"));
    }
}
