package com.atlas.core.planning;

import com.atlas.core.model.Complexity;
import com.atlas.core.model.Effort;
import com.atlas.core.model.ExecutionPlan;
import com.atlas.core.model.Milestone;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Heuristic planner for common request shapes. Produces canned plans with the
 * same schema as AI-generated ones, without any network call.
 * <p>
 * Templates are checked in declaration order; the first whose predicate
 * matches builds the plan. An empty result means the task needs AI planning.
 */
@Component
public class QuickPlanner {

    private static final Pattern RETRIEVAL = Pattern.compile("^(list|show|get|fetch|display)\\s", Pattern.CASE_INSENSITIVE);
    private static final Pattern CREATION = Pattern.compile("^(create|add|make|new)\\s", Pattern.CASE_INSENSITIVE);
    private static final Pattern DELETION = Pattern.compile("^(delete|remove|destroy)\\s", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEPLOYMENT = Pattern.compile("deploy|release|ship");
    private static final Pattern ANALYSIS = Pattern.compile("analyze|review|audit|examine|assess|evaluate|improve");
    private static final Pattern CODEBASE = Pattern.compile("repo|codebase|project|code|architecture");

    private record Template(String name, Predicate<String> matches, Function<String, ExecutionPlan> build) {}

    private final List<Template> templates = List.of(
            new Template("retrieval", t -> RETRIEVAL.matcher(t).find(), t -> retrievalPlan()),
            new Template("creation", t -> CREATION.matcher(t).find(), t -> creationPlan()),
            new Template("deletion", t -> DELETION.matcher(t).find(), t -> deletionPlan()),
            new Template("deployment", t -> DEPLOYMENT.matcher(t.toLowerCase()).find(), t -> deploymentPlan()),
            new Template("analysis", t -> ANALYSIS.matcher(t.toLowerCase()).find(), QuickPlanner::analysisPlan)
    );

    /**
     * Builds a canned plan for the task if one of the templates recognises it.
     *
     * @return the plan, or empty when the task should be escalated to AI planning
     */
    public Optional<ExecutionPlan> createQuickPlan(String taskDescription) {
        if (taskDescription == null) {
            return Optional.empty();
        }
        for (Template template : templates) {
            if (template.matches().test(taskDescription)) {
                return Optional.of(template.build().apply(taskDescription));
            }
        }
        return Optional.empty();
    }

    private static ExecutionPlan retrievalPlan() {
        return plan("Information retrieval task", Complexity.SIMPLE, Effort.QUICK, false,
                "fetch", "Fetch requested information",
                "present", "Present results to user");
    }

    private static ExecutionPlan creationPlan() {
        return plan("Creation task", Complexity.MODERATE, Effort.MEDIUM, false,
                "validate", "Validate inputs and prerequisites",
                "create", "Create the requested resource",
                "verify", "Verify creation was successful");
    }

    private static ExecutionPlan deletionPlan() {
        return plan("Deletion task", Complexity.SIMPLE, Effort.QUICK, false,
                "confirm", "Confirm resource exists",
                "delete", "Delete the resource",
                "verify", "Verify deletion");
    }

    private static ExecutionPlan deploymentPlan() {
        return plan("Deployment task", Complexity.COMPLEX, Effort.SUBSTANTIAL, true,
                "check_status", "Check current deployment status",
                "validate", "Validate deployment prerequisites",
                "build", "Build/prepare for deployment",
                "deploy", "Execute deployment",
                "verify", "Verify deployment success");
    }

    private static ExecutionPlan analysisPlan(String taskDescription) {
        if (CODEBASE.matcher(taskDescription.toLowerCase()).find()) {
            return plan("Codebase analysis task", Complexity.EXPLORATORY, Effort.SUBSTANTIAL, true,
                    "explore_structure", "Explore project structure",
                    "identify_components", "Identify key components",
                    "analyze_patterns", "Analyze code patterns and architecture",
                    "identify_issues", "Identify areas for improvement",
                    "generate_recommendations", "Generate recommendations",
                    "present_findings", "Present findings to user");
        }
        return plan("Analysis task", Complexity.MODERATE, Effort.MEDIUM, true,
                "gather", "Gather relevant information",
                "analyze", "Analyze the information",
                "synthesize", "Synthesize findings",
                "present", "Present analysis results");
    }

    /**
     * Builds a plan from alternating id/description pairs. Milestones are
     * always fresh instances so callers never share completion state.
     */
    static ExecutionPlan plan(String summary, Complexity complexity, Effort effort,
                              boolean explorationNeeded, String... idsAndDescriptions) {
        var milestones = new ArrayList<Milestone>();
        for (int i = 0; i + 1 < idsAndDescriptions.length; i += 2) {
            milestones.add(new Milestone(idsAndDescriptions[i], idsAndDescriptions[i + 1]));
        }
        return new ExecutionPlan(summary, complexity, effort, explorationNeeded, milestones);
    }
}
