package com.atlas.core.model;

import java.util.List;

/**
 * Input to the AI execution planner. Not retained after planning.
 *
 * @param originalTask        the task as the user described it
 * @param explorationFindings what has been learned so far, may be null
 * @param availableTools      tool names the executor can use, may be empty
 * @param constraints         limitations to respect, may be empty
 */
public record PlanningContext(
    String originalTask,
    String explorationFindings,
    List<String> availableTools,
    List<String> constraints
) {
    public PlanningContext {
        originalTask = originalTask != null ? originalTask : "";
        availableTools = availableTools != null ? List.copyOf(availableTools) : List.of();
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
    }

    public static PlanningContext of(String originalTask) {
        return new PlanningContext(originalTask, null, List.of(), List.of());
    }
}
