package com.atlas.core.model;

import java.util.List;

/**
 * Snapshot of how far a plan has progressed.
 *
 * @param completed  number of completed milestones
 * @param total      number of milestones in the plan
 * @param percentage completed / total as a rounded integer percentage
 * @param remaining  pending milestones in plan order
 */
public record PlanProgress(
    int completed,
    int total,
    int percentage,
    List<Milestone> remaining
) {
    public PlanProgress {
        remaining = List.copyOf(remaining);
    }
}
