package com.atlas.core.model;

/**
 * External integration that has to be enabled for a tool to be offered.
 * {@link #CORE} tools are always available.
 */
public enum Integration {
    CORE,
    TRELLO,
    HETZNER,
    CLAUDE_CONTAINERS
}
