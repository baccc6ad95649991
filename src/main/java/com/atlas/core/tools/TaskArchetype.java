package com.atlas.core.tools;

import java.util.regex.Pattern;

/**
 * Task shapes the tool-aware planner has milestone templates for.
 * <p>
 * The predicates overlap ("implement a deployment pipeline" is both a
 * deployment and an implementation). {@link #detect} checks them in
 * declaration order and the first match wins, so the order of the constants
 * is behaviour.
 */
public enum TaskArchetype {

    CODEBASE_ANALYSIS {
        private final Pattern verbs = Pattern.compile("analyze|review|audit|examine|improve|refactor");
        private final Pattern targets = Pattern.compile("repo|codebase|code|project|architecture");

        @Override
        boolean matches(String lower) {
            return verbs.matcher(lower).find() && targets.matcher(lower).find();
        }
    },
    DEPLOYMENT {
        private final Pattern pattern = Pattern.compile("deploy|ship|release|launch|publish");

        @Override
        boolean matches(String lower) {
            return pattern.matcher(lower).find();
        }
    },
    TASK_MANAGEMENT {
        private final Pattern pattern = Pattern.compile("trello|card|board|task|todo|plan|organize");

        @Override
        boolean matches(String lower) {
            return pattern.matcher(lower).find();
        }
    },
    IMPLEMENTATION {
        private final Pattern pattern = Pattern.compile("implement|build|create|develop|add|feature");

        @Override
        boolean matches(String lower) {
            return pattern.matcher(lower).find();
        }
    },
    GENERIC_EXPLORATION {
        @Override
        boolean matches(String lower) {
            return true;
        }
    };

    abstract boolean matches(String lower);

    public String wireName() {
        return name().toLowerCase();
    }

    public static TaskArchetype detect(String taskDescription) {
        String lower = taskDescription != null ? taskDescription.toLowerCase() : "";
        for (TaskArchetype archetype : values()) {
            if (archetype.matches(lower)) {
                return archetype;
            }
        }
        return GENERIC_EXPLORATION;
    }
}
