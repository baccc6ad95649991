package com.atlas.core.engine;

import com.atlas.core.context.ContextSummarizer;
import com.atlas.core.intent.IntentClassifier;
import com.atlas.core.logging.MdcContext;
import com.atlas.core.metrics.AtlasMetrics;
import com.atlas.core.model.ClassificationResult;
import com.atlas.core.model.ConversationMessage;
import com.atlas.core.model.ExecutionPlan;
import com.atlas.core.model.PlanningContext;
import com.atlas.core.model.ToolAwarePlan;
import com.atlas.core.planning.ExecutionPlanner;
import com.atlas.core.tools.ToolAwarePlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for a conversational turn: classifies the message and, when it
 * asks for work, produces the plan the executor should follow.
 */
@Service
public class PlanningEngine {

    private static final Logger log = LoggerFactory.getLogger(PlanningEngine.class);

    private final IntentClassifier intentClassifier;
    private final ExecutionPlanner executionPlanner;
    private final ToolAwarePlanner toolAwarePlanner;
    private final ContextSummarizer contextSummarizer;
    private final AtlasMetrics metrics;
    private final AtomicInteger turnCounter = new AtomicInteger(0);

    public PlanningEngine(IntentClassifier intentClassifier, ExecutionPlanner executionPlanner,
                          ToolAwarePlanner toolAwarePlanner, ContextSummarizer contextSummarizer,
                          AtlasMetrics metrics) {
        this.intentClassifier = intentClassifier;
        this.executionPlanner = executionPlanner;
        this.toolAwarePlanner = toolAwarePlanner;
        this.contextSummarizer = contextSummarizer;
        this.metrics = metrics;
    }

    public TurnDecision handleMessage(String message) {
        return handleMessage(message, false);
    }

    /**
     * Classifies {@code message} and plans it when it is a task.
     *
     * @param useToolAwarePlanner plan with tool routing instead of the AI planner
     */
    public TurnDecision handleMessage(String message, boolean useToolAwarePlanner) {
        String turnId = generateTurnId();
        MdcContext.setTurn(turnId);
        try {
            ClassificationResult classification = intentClassifier.classify(message);
            MdcContext.setIntent(turnId, classification.intent().wireName());
            metrics.recordClassification(classification.intent().wireName());
            log.info("Turn {} classified as {} ({} confidence): {}", turnId,
                    classification.intent().wireName(), classification.confidence().wireName(),
                    classification.reasoning());

            if (!classification.shouldExecuteTask()) {
                return TurnDecision.reply(turnId, classification);
            }

            if (useToolAwarePlanner) {
                ToolAwarePlan toolPlan = toolAwarePlanner.createPlan(message);
                log.info("Turn {} planned with tools: {}", turnId, toolPlan.toolsRequired());
                return new TurnDecision(turnId, classification, Optional.empty(), Optional.of(toolPlan));
            }

            ExecutionPlan plan = executionPlanner.createPlan(PlanningContext.of(message));
            log.info("Turn {} planned: {} milestones ({})", turnId, plan.milestones().size(),
                    plan.complexity().wireName());
            return new TurnDecision(turnId, classification, Optional.of(plan), Optional.empty());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Summarizes the history once it grows past the configured window, otherwise
     * returns it unchanged.
     */
    public List<ConversationMessage> compactHistory(List<ConversationMessage> messages) {
        if (messages.size() <= contextSummarizer.keepRecent()) {
            return messages;
        }
        return contextSummarizer.summarizeContext(messages);
    }

    /**
     * Generates a turn id in the format ATLS-YYYY-NNNN.
     */
    public String generateTurnId() {
        int count = turnCounter.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("ATLS-%d-%04d", year, count);
    }
}
