package com.atlas.core.planning;

import com.atlas.core.llm.LlmProperties;
import com.atlas.core.llm.LlmService;
import com.atlas.core.metrics.AtlasMetrics;
import com.atlas.core.model.Complexity;
import com.atlas.core.model.ExecutionPlan;
import com.atlas.core.model.PlanDraft;
import com.atlas.core.model.PlanningContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Creates execution plans, trying the {@link QuickPlanner} first and escalating
 * to the LLM for exploratory or unrecognised tasks.
 * <p>
 * Planning never fails from the caller's point of view: network errors, empty
 * responses and malformed JSON all resolve to {@link FallbackPlans#generic}.
 * There is exactly one LLM attempt per call.
 */
@Service
public class ExecutionPlanner {

    private static final Logger log = LoggerFactory.getLogger(ExecutionPlanner.class);

    static final String SYSTEM_PROMPT = """
            You are an execution planning expert. Create structured, actionable plans.

            Your job:
            1. Understand the task goal
            2. Break it into clear milestones
            3. Order milestones logically
            4. Estimate complexity

            RULES:
            - Each milestone should be independently verifiable
            - Milestones should be ordered by dependency
            - Don't over-decompose (3-8 milestones typically)
            - Be realistic about complexity

            COMPLEXITY LEVELS:
            - simple: 1-3 steps, single focus
            - moderate: 3-5 steps, clear path
            - complex: 5-8 steps, multiple concerns
            - exploratory: Unknown scope, requires discovery

            EFFORT LEVELS:
            - quick: < 5 minutes
            - medium: 5-15 minutes
            - substantial: 15+ minutes

            Respond ONLY with JSON:
            {
              "taskSummary": "brief description",
              "complexity": "simple|moderate|complex|exploratory",
              "estimatedEffort": "quick|medium|substantial",
              "explorationNeeded": true|false,
              "milestones": [
                {
                  "id": "snake_case_id",
                  "description": "Clear action description",
                  "completed": false
                }
              ]
            }
            """;

    private final LlmService llmService;
    private final QuickPlanner quickPlanner;
    private final LlmProperties properties;
    private final AtlasMetrics metrics;

    public ExecutionPlanner(LlmService llmService, QuickPlanner quickPlanner,
                            LlmProperties properties, AtlasMetrics metrics) {
        this.llmService = llmService;
        this.quickPlanner = quickPlanner;
        this.properties = properties;
        this.metrics = metrics;
    }

    public ExecutionPlan createPlan(PlanningContext context) {
        long start = System.currentTimeMillis();
        try {
            return plan(context);
        } finally {
            metrics.recordPlanningDuration(System.currentTimeMillis() - start);
        }
    }

    private ExecutionPlan plan(PlanningContext context) {
        Optional<ExecutionPlan> quickPlan = quickPlanner.createQuickPlan(context.originalTask());
        // Exploratory quick plans still go to the LLM; only concrete shapes short-circuit.
        if (quickPlan.isPresent() && quickPlan.get().complexity() != Complexity.EXPLORATORY) {
            log.info("Using quick plan for straightforward task ({} milestones)",
                    quickPlan.get().milestones().size());
            metrics.recordPlanSource("quick");
            return quickPlan.get();
        }

        log.info("Creating AI-powered execution plan...");
        try {
            PlanDraft draft = llmService.structuredCall(SYSTEM_PROMPT, buildPlanningPrompt(context),
                    properties.getPlanningMaxTokens(), PlanDraft.class);
            ExecutionPlan plan = PlanDraftMapper.toPlan(draft, context.originalTask());
            log.info("Plan created: {} complexity, {} milestones",
                    plan.complexity().wireName(), plan.milestones().size());
            metrics.recordPlanSource("ai");
            return plan;
        } catch (Exception e) {
            log.error("Failed to create AI plan, falling back to generic: {}", e.getMessage());
            log.debug("AI planning failure", e);
        }

        metrics.recordPlanSource("fallback");
        return FallbackPlans.generic(context.originalTask());
    }

    String buildPlanningPrompt(PlanningContext context) {
        var sb = new StringBuilder("Create an execution plan for this task:\n\nTASK: ")
                .append(context.originalTask());
        if (context.explorationFindings() != null && !context.explorationFindings().isBlank()) {
            sb.append("\n\nFINDINGS FROM EXPLORATION:\n").append(context.explorationFindings());
        }
        if (!context.availableTools().isEmpty()) {
            sb.append("\n\nAVAILABLE TOOLS: ").append(String.join(", ", context.availableTools()));
        }
        if (!context.constraints().isEmpty()) {
            sb.append("\n\nCONSTRAINTS: ").append(String.join(", ", context.constraints()));
        }
        return sb.toString();
    }
}
