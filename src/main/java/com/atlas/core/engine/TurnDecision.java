package com.atlas.core.engine;

import com.atlas.core.model.ClassificationResult;
import com.atlas.core.model.ExecutionPlan;
import com.atlas.core.model.ToolAwarePlan;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of handling one inbound message: how it was classified and, for
 * tasks, the plan to execute. At most one of {@code plan} and {@code toolPlan}
 * is present.
 */
public record TurnDecision(
    String turnId,
    ClassificationResult classification,
    Optional<ExecutionPlan> plan,
    Optional<ToolAwarePlan> toolPlan
) {
    public TurnDecision {
        Objects.requireNonNull(classification, "classification");
        plan = plan != null ? plan : Optional.empty();
        toolPlan = toolPlan != null ? toolPlan : Optional.empty();
    }

    static TurnDecision reply(String turnId, ClassificationResult classification) {
        return new TurnDecision(turnId, classification, Optional.empty(), Optional.empty());
    }

    public boolean requiresExecution() {
        return classification.shouldExecuteTask();
    }

    /** The plan to execute, whichever planner produced it. */
    public Optional<ExecutionPlan> executionPlan() {
        return toolPlan.map(ToolAwarePlan::asExecutionPlan).or(() -> plan);
    }
}
