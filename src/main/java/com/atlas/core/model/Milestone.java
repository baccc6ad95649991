package com.atlas.core.model;

import java.util.Objects;

/**
 * A single verifiable unit of work within an {@link ExecutionPlan}.
 * <p>
 * The id and description are fixed at creation. The completion flag only ever
 * moves from {@code false} to {@code true}; there is no way to reopen a
 * milestone.
 */
public class Milestone {

    private final String id;
    private final String description;
    private boolean completed;

    public Milestone(String id, String description) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Milestone id must not be blank");
        }
        this.id = id;
        this.description = Objects.requireNonNullElse(description, "");
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * Marks this milestone as done.
     *
     * @return {@code true} if this call moved the milestone from pending to
     *         completed, {@code false} if it was already completed
     */
    public boolean markCompleted() {
        if (completed) {
            return false;
        }
        completed = true;
        return true;
    }

    @Override
    public String toString() {
        return (completed ? "[x] " : "[ ] ") + id + ": " + description;
    }
}
