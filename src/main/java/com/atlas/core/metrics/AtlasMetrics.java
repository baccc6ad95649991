package com.atlas.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for classification, planning and summarization.
 */
@Service
public class AtlasMetrics {

    private final MeterRegistry registry;

    public AtlasMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordClassification(String intent) {
        Counter.builder("atlas.classifications.total")
                .tag("intent", intent)
                .register(registry)
                .increment();
    }

    /**
     * Records where a plan came from.
     *
     * @param source "quick", "ai", "fallback" or "tool_aware"
     */
    public void recordPlanSource(String source) {
        Counter.builder("atlas.plans.total")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("atlas.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordArchetype(String archetype) {
        Counter.builder("atlas.tool_plans.archetype")
                .tag("archetype", archetype)
                .register(registry)
                .increment();
    }

    public void recordSummaryCacheLookup(boolean hit) {
        Counter.builder("atlas.summary.cache")
                .description("Conversation summary cache lookups")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordSummaryFallback() {
        Counter.builder("atlas.summary.fallbacks")
                .description("Summaries produced by local truncation after an LLM failure")
                .register(registry)
                .increment();
    }
}
