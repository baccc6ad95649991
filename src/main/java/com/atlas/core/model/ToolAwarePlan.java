package com.atlas.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An {@link ExecutionPlan} enriched with tool routing and delegation guidance.
 *
 * @param toolsRequired           deduplicated union of the milestones' suggested tools
 * @param delegationOpportunities human-readable notes on work that can go to a sub-agent
 */
public record ToolAwarePlan(
    String taskSummary,
    Complexity complexity,
    Effort estimatedEffort,
    boolean explorationNeeded,
    List<ToolAwareMilestone> milestones,
    List<String> toolsRequired,
    List<String> delegationOpportunities
) {
    public ToolAwarePlan {
        Objects.requireNonNull(complexity, "complexity");
        Objects.requireNonNull(estimatedEffort, "estimatedEffort");
        taskSummary = Objects.requireNonNullElse(taskSummary, "");
        milestones = ExecutionPlan.requireValidMilestones(milestones);
        toolsRequired = toolsRequired != null ? List.copyOf(toolsRequired) : List.of();
        delegationOpportunities = delegationOpportunities != null ? List.copyOf(delegationOpportunities) : List.of();
    }

    /**
     * Views this plan as a plain {@link ExecutionPlan}. The returned plan shares
     * the same milestone instances, so completing a milestone through a tracker
     * built on the view is visible here too.
     */
    public ExecutionPlan asExecutionPlan() {
        return new ExecutionPlan(taskSummary, complexity, estimatedEffort, explorationNeeded,
                List.<Milestone>copyOf(milestones));
    }
}
