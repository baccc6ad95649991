package com.atlas.core.tools;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskArchetypeTest {

    @Test
    @DisplayName("codebase analysis needs both a verb and a target")
    void codebaseAnalysis() {
        assertEquals(TaskArchetype.CODEBASE_ANALYSIS, TaskArchetype.detect("Review the repo"));
        assertEquals(TaskArchetype.CODEBASE_ANALYSIS, TaskArchetype.detect("refactor the project"));
        assertNotEquals(TaskArchetype.CODEBASE_ANALYSIS, TaskArchetype.detect("review my essay"));
    }

    @Test
    @DisplayName("earlier archetypes win over later ones")
    void priorityOrder() {
        // matches deployment, task management and implementation
        assertEquals(TaskArchetype.DEPLOYMENT, TaskArchetype.detect("build and deploy the task board"));
        // matches task management and implementation
        assertEquals(TaskArchetype.TASK_MANAGEMENT, TaskArchetype.detect("create a trello card"));
        assertEquals(TaskArchetype.IMPLEMENTATION, TaskArchetype.detect("add dark mode"));
    }

    @Test
    @DisplayName("anything else is generic exploration")
    void fallback() {
        assertEquals(TaskArchetype.GENERIC_EXPLORATION, TaskArchetype.detect("how many users signed up"));
        assertEquals(TaskArchetype.GENERIC_EXPLORATION, TaskArchetype.detect(null));
        assertEquals("generic_exploration", TaskArchetype.GENERIC_EXPLORATION.wireName());
    }
}
