package com.atlas.core.model;

import java.util.List;

/**
 * Milestone annotated with the tools that should be used to reach it.
 */
public class ToolAwareMilestone extends Milestone {

    private final List<String> suggestedTools;
    private final String toolStrategy;
    private final boolean canDelegate;

    public ToolAwareMilestone(String id, String description, List<String> suggestedTools,
                              String toolStrategy, boolean canDelegate) {
        super(id, description);
        this.suggestedTools = suggestedTools != null ? List.copyOf(suggestedTools) : List.of();
        this.toolStrategy = toolStrategy;
        this.canDelegate = canDelegate;
    }

    public ToolAwareMilestone(String id, String description, List<String> suggestedTools, String toolStrategy) {
        this(id, description, suggestedTools, toolStrategy, false);
    }

    public List<String> getSuggestedTools() {
        return suggestedTools;
    }

    /** Free-text hint on how to use the suggested tools; may be null. */
    public String getToolStrategy() {
        return toolStrategy;
    }

    /** Whether this milestone can be handed to an autonomous sub-agent. */
    public boolean isCanDelegate() {
        return canDelegate;
    }
}
