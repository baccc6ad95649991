package com.atlas.core.context;

import com.atlas.core.llm.LlmEmptyResponseException;
import com.atlas.core.llm.LlmProperties;
import com.atlas.core.llm.LlmService;
import com.atlas.core.metrics.AtlasMetrics;
import com.atlas.core.model.ConversationMessage;
import com.atlas.core.model.Role;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ContextSummarizerTest {

    private LlmService mockLlm;
    private SummaryCache cache;
    private SimpleMeterRegistry registry;
    private ContextSummarizer summarizer;

    @BeforeEach
    void setUp() {
        mockLlm = mock(LlmService.class);
        cache = new SummaryCache();
        registry = new SimpleMeterRegistry();
        summarizer = new ContextSummarizer(mockLlm, cache, new LlmProperties(), new SummarizerProperties(),
                new AtlasMetrics(registry));
    }

    private static List<ConversationMessage> conversation(int size) {
        return IntStream.range(0, size)
                .mapToObj(i -> i % 2 == 0
                        ? ConversationMessage.user("question " + i)
                        : ConversationMessage.assistant("answer " + i))
                .toList();
    }

    @Test
    @DisplayName("history within the window is returned unchanged without an LLM call")
    void withinWindow() {
        var messages = conversation(10);
        assertSame(messages, summarizer.summarizeContext(messages));
        verifyNoInteractions(mockLlm);
    }

    @Test
    @DisplayName("older messages are replaced by one summary message, recent ones kept verbatim")
    void summarizesOlderMessages() {
        when(mockLlm.call(any(), anyString(), anyInt())).thenReturn("They discussed deployments.");
        var messages = conversation(12);

        List<ConversationMessage> result = summarizer.summarizeContext(messages);

        assertEquals(11, result.size());
        ConversationMessage summary = result.get(0);
        assertEquals(Role.USER, summary.role());
        assertEquals("📝 CONVERSATION SUMMARY (2 messages):\n\nThey discussed deployments."
                + "\n\n--- Recent messages below (full context) ---", summary.content());
        assertEquals(messages.subList(2, 12), result.subList(1, 11));
    }

    @Test
    @DisplayName("summary prompt labels speakers and uses the summary token cap")
    void promptFormat() {
        when(mockLlm.call(any(), anyString(), anyInt())).thenReturn("ok");

        summarizer.summarizeContext(conversation(4), 2);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(mockLlm).call(isNull(), prompt.capture(), eq(1024));
        assertTrue(prompt.getValue().contains("User: question 0\n\nAssistant: answer 1"));
        assertTrue(prompt.getValue().contains("1. Key topics discussed"));
    }

    @Test
    @DisplayName("same older span is summarized once and then served from the cache")
    void cachesSummary() {
        when(mockLlm.call(any(), anyString(), anyInt())).thenReturn("cached summary");
        var messages = conversation(12);

        summarizer.summarizeContext(messages);
        List<ConversationMessage> second = summarizer.summarizeContext(messages);

        verify(mockLlm, times(1)).call(any(), anyString(), anyInt());
        assertTrue(second.get(0).content().contains("cached summary"));
        assertEquals(1.0, registry.find("atlas.summary.cache").tag("result", "miss").counter().count());
        assertEquals(1.0, registry.find("atlas.summary.cache").tag("result", "hit").counter().count());
    }

    @Test
    @DisplayName("LLM failure falls back to truncation and the fallback is cached")
    void fallbackOnFailure() {
        when(mockLlm.call(any(), anyString(), anyInt())).thenThrow(new LlmEmptyResponseException("empty"));
        var messages = new ArrayList<>(conversation(10));
        messages.add(0, ConversationMessage.assistant("z".repeat(150)));
        messages.add(1, ConversationMessage.user("short"));

        List<ConversationMessage> result = summarizer.summarizeContext(messages);

        assertTrue(result.get(0).content().contains("assistant: " + "z".repeat(100) + "...\nuser: short..."));
        assertEquals(1, cache.size());
        assertEquals(1.0, registry.find("atlas.summary.fallbacks").counter().count());

        summarizer.summarizeContext(messages);
        verify(mockLlm, times(1)).call(any(), anyString(), anyInt());
    }

    @Test
    @DisplayName("keep count of zero summarizes everything")
    void keepZero() {
        when(mockLlm.call(any(), anyString(), anyInt())).thenReturn("all of it");

        List<ConversationMessage> result = summarizer.summarizeContext(conversation(3), 0);

        assertEquals(1, result.size());
        assertTrue(result.get(0).content().startsWith("📝 CONVERSATION SUMMARY (3 messages):"));
    }

    @Test
    @DisplayName("negative keep count is treated as zero")
    void negativeKeep() {
        when(mockLlm.call(any(), anyString(), anyInt())).thenReturn("s");
        assertEquals(1, summarizer.summarizeContext(conversation(3), -1).size());
    }

    @Test
    @DisplayName("clearCache forces a new summary")
    void clearCache() {
        when(mockLlm.call(any(), anyString(), anyInt())).thenReturn("s");
        var messages = conversation(12);

        summarizer.summarizeContext(messages);
        summarizer.clearCache();
        summarizer.summarizeContext(messages);

        verify(mockLlm, times(2)).call(any(), anyString(), anyInt());
    }
}
