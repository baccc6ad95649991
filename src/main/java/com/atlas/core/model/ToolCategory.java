package com.atlas.core.model;

/**
 * Broad kind of work a tool performs.
 */
public enum ToolCategory {
    EXPLORATION,
    CREATION,
    MODIFICATION,
    DEPLOYMENT,
    MONITORING,
    DELEGATION
}
