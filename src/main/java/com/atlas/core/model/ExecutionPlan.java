package com.atlas.core.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Structured multi-step plan describing how to accomplish a task.
 * <p>
 * Milestone order is execution order: earlier milestones are prerequisites of
 * later ones. A plan always has at least one milestone and milestone ids are
 * unique within it.
 *
 * @param taskSummary       short description of the task
 * @param complexity        how hard the task is
 * @param estimatedEffort   expected effort bucket
 * @param explorationNeeded whether discovery work is required before executing
 * @param milestones        ordered milestones; the instances are shared, not copied
 */
public record ExecutionPlan(
    String taskSummary,
    Complexity complexity,
    Effort estimatedEffort,
    boolean explorationNeeded,
    List<Milestone> milestones
) {
    public ExecutionPlan {
        Objects.requireNonNull(complexity, "complexity");
        Objects.requireNonNull(estimatedEffort, "estimatedEffort");
        taskSummary = Objects.requireNonNullElse(taskSummary, "");
        milestones = requireValidMilestones(milestones);
    }

    static <M extends Milestone> List<M> requireValidMilestones(List<M> milestones) {
        if (milestones == null || milestones.isEmpty()) {
            throw new IllegalArgumentException("A plan must contain at least one milestone");
        }
        var seen = new HashSet<String>();
        for (var m : milestones) {
            Objects.requireNonNull(m, "milestone");
            if (!seen.add(m.getId())) {
                throw new IllegalArgumentException("Duplicate milestone id: " + m.getId());
            }
        }
        return List.copyOf(milestones);
    }
}
