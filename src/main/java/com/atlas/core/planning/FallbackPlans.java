package com.atlas.core.planning;

import com.atlas.core.model.Complexity;
import com.atlas.core.model.Effort;
import com.atlas.core.model.ExecutionPlan;

/**
 * Statically defined plans used when AI planning fails.
 */
public final class FallbackPlans {

    static final int SUMMARY_LIMIT = 100;

    private FallbackPlans() {}

    /**
     * Generic understand / explore / execute / verify / report plan.
     */
    public static ExecutionPlan generic(String task) {
        return QuickPlanner.plan(truncate(task), Complexity.EXPLORATORY, Effort.SUBSTANTIAL, true,
                "understand", "Understand the task requirements",
                "explore", "Explore and gather information",
                "execute", "Execute the main task",
                "verify", "Verify results",
                "report", "Report findings to user");
    }

    static String truncate(String task) {
        if (task == null) {
            return "";
        }
        return task.length() <= SUMMARY_LIMIT ? task : task.substring(0, SUMMARY_LIMIT);
    }
}
