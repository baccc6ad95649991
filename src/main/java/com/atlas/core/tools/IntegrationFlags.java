package com.atlas.core.tools;

import com.atlas.core.model.Integration;

/**
 * Which optional integrations are configured for this agent.
 */
public record IntegrationFlags(
    boolean hasTrello,
    boolean hasHetzner,
    boolean hasClaudeContainers
) {

    public static IntegrationFlags all() {
        return new IntegrationFlags(true, true, true);
    }

    public static IntegrationFlags none() {
        return new IntegrationFlags(false, false, false);
    }

    public boolean isEnabled(Integration integration) {
        return switch (integration) {
            case CORE -> true;
            case TRELLO -> hasTrello;
            case HETZNER -> hasHetzner;
            case CLAUDE_CONTAINERS -> hasClaudeContainers;
        };
    }
}
