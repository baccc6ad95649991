package com.atlas.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A declared integration action tagged with the keywords it is useful for.
 *
 * @param name        tool name as exposed to the executor (e.g. "deploy_to_hetzner")
 * @param category    kind of work the tool performs
 * @param integration integration that gates availability of this tool
 * @param description one-line description
 * @param bestFor     lower-case keywords; declaration order is kept
 * @param requires    prerequisites such as credentials, may be empty
 */
public record ToolCapability(
    String name,
    ToolCategory category,
    Integration integration,
    String description,
    List<String> bestFor,
    List<String> requires
) {
    public ToolCapability {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(integration, "integration");
        bestFor = bestFor != null ? bestFor.stream().map(String::toLowerCase).distinct().toList() : List.of();
        requires = requires != null ? List.copyOf(requires) : List.of();
    }

    public ToolCapability(String name, ToolCategory category, Integration integration,
                          String description, List<String> bestFor) {
        this(name, category, integration, description, bestFor, List.of());
    }

    /**
     * Counts how many {@link #bestFor} keywords appear in the given lower-cased text.
     */
    public int score(String lowerText) {
        int score = 0;
        for (String keyword : bestFor) {
            if (lowerText.contains(keyword)) {
                score++;
            }
        }
        return score;
    }
}
