package com.atlas.core.tools;

import com.atlas.core.metrics.AtlasMetrics;
import com.atlas.core.model.Complexity;
import com.atlas.core.model.Effort;
import com.atlas.core.model.ToolAwareMilestone;
import com.atlas.core.model.ToolAwarePlan;
import com.atlas.core.model.ToolCapability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds execution plans that name the tools to use for each milestone and
 * point out work that can be delegated to a sub-agent.
 * <p>
 * The set of available tools is computed once from the {@link IntegrationFlags}
 * given at construction: core tools plus every tool whose integration is
 * enabled. Tools of disabled integrations never appear in rankings or in
 * milestone suggestions.
 */
public class ToolAwarePlanner {

    private static final Logger log = LoggerFactory.getLogger(ToolAwarePlanner.class);

    private static final Pattern DELEGATION_VERBS = Pattern.compile("implement|build|refactor|create|develop");
    private static final Pattern DELEGATION_SCALE = Pattern.compile("complex|large|entire|full");

    static final String MAIN_DELEGATION_NOTE = "Main implementation can be delegated to Claude agent";

    private final IntegrationFlags flags;
    private final AtlasMetrics metrics;
    private final List<ToolCapability> availableTools;
    private final Set<String> availableNames;

    public ToolAwarePlanner(ToolRegistry registry, IntegrationFlags flags, AtlasMetrics metrics) {
        this.flags = flags;
        this.metrics = metrics;
        this.availableTools = registry.all().stream()
                .filter(t -> flags.isEnabled(t.integration()))
                .toList();
        this.availableNames = availableTools.stream()
                .map(ToolCapability::name)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        log.info("Tool-aware planner ready with {} tools (trello={}, hetzner={}, claudeContainers={})",
                availableTools.size(), flags.hasTrello(), flags.hasHetzner(), flags.hasClaudeContainers());
    }

    public ToolAwarePlanner(ToolRegistry registry, IntegrationFlags flags) {
        this(registry, flags, null);
    }

    public List<ToolCapability> availableTools() {
        return availableTools;
    }

    public boolean isAvailable(String toolName) {
        return availableNames.contains(toolName);
    }

    /**
     * Ranks the available tools by how many of their keywords appear in the
     * task. Ties keep registry order; tools with no matching keyword are left out.
     */
    public List<ToolCapability> findBestTools(String taskDescription) {
        String lower = taskDescription != null ? taskDescription.toLowerCase() : "";
        record Scored(ToolCapability tool, int score) {}
        return availableTools.stream()
                .map(t -> new Scored(t, t.score(lower)))
                .filter(s -> s.score() > 0)
                .sorted(Comparator.comparingInt(Scored::score).reversed())
                .map(Scored::tool)
                .toList();
    }

    public ToolAwarePlan createPlan(String taskDescription) {
        String task = taskDescription != null ? taskDescription : "";
        List<ToolCapability> bestTools = findBestTools(task);
        log.info("Tool analysis: found {} relevant tools", bestTools.size());
        bestTools.stream().limit(5).forEach(t -> log.info("   - {}: {}", t.name(), t.description()));

        TaskArchetype archetype = TaskArchetype.detect(task);
        log.info("Task archetype: {}", archetype.wireName());
        if (metrics != null) {
            metrics.recordArchetype(archetype.wireName());
            metrics.recordPlanSource("tool_aware");
        }

        PlanTemplate template = switch (archetype) {
            case CODEBASE_ANALYSIS -> codebaseAnalysisTemplate();
            case DEPLOYMENT -> deploymentTemplate();
            case TASK_MANAGEMENT -> taskManagementTemplate();
            case IMPLEMENTATION -> implementationTemplate();
            case GENERIC_EXPLORATION -> explorationTemplate(task, bestTools);
        };

        List<ToolAwareMilestone> milestones = template.milestones().stream()
                .map(this::withAvailableTools)
                .toList();
        var toolsRequired = new LinkedHashSet<String>();
        milestones.forEach(m -> toolsRequired.addAll(m.getSuggestedTools()));

        return new ToolAwarePlan(template.summary(), template.complexity(), template.effort(),
                template.explorationNeeded(), milestones, List.copyOf(toolsRequired),
                findDelegationOpportunities(task, milestones));
    }

    /**
     * Renders a plan as a Markdown message listing required tools, per-milestone
     * tools and strategies, and delegation opportunities.
     */
    public String renderRecommendation(ToolAwarePlan plan) {
        var lines = new ArrayList<String>();
        lines.add("🔧 **Tool-Aware Plan**");
        lines.add("**Required Tools:** " + String.join(", ", plan.toolsRequired()));
        lines.add("");
        lines.add("**Milestones:**");
        for (ToolAwareMilestone m : plan.milestones()) {
            lines.add("  " + (m.isCompleted() ? "✅" : "⬜") + " " + m.getDescription());
            if (!m.getSuggestedTools().isEmpty()) {
                lines.add("     Tools: " + String.join(", ", m.getSuggestedTools()));
            }
            if (m.getToolStrategy() != null) {
                lines.add("     Strategy: " + m.getToolStrategy());
            }
        }
        if (!plan.delegationOpportunities().isEmpty()) {
            lines.add("");
            lines.add("**🤖 Delegation Opportunities:**");
            plan.delegationOpportunities().forEach(o -> lines.add("  - " + o));
        }
        return String.join("\n", lines);
    }

    private List<String> findDelegationOpportunities(String task, List<ToolAwareMilestone> milestones) {
        if (!flags.hasClaudeContainers()) {
            return List.of();
        }
        var opportunities = new ArrayList<String>();
        String lower = task.toLowerCase();
        if (DELEGATION_VERBS.matcher(lower).find() && DELEGATION_SCALE.matcher(lower).find()) {
            opportunities.add(MAIN_DELEGATION_NOTE);
        }
        milestones.stream()
                .filter(ToolAwareMilestone::isCanDelegate)
                .forEach(m -> opportunities.add("Milestone \"" + m.getId() + "\" can be delegated"));
        return opportunities;
    }

    private ToolAwareMilestone withAvailableTools(ToolAwareMilestone m) {
        List<String> tools = m.getSuggestedTools().stream().filter(this::isAvailable).toList();
        if (tools.size() == m.getSuggestedTools().size()) {
            return m;
        }
        return new ToolAwareMilestone(m.getId(), m.getDescription(), tools, m.getToolStrategy(), m.isCanDelegate());
    }

    // ── Templates ───────────────────────────────────────────────────────

    private record PlanTemplate(
        String summary,
        Complexity complexity,
        Effort effort,
        boolean explorationNeeded,
        List<ToolAwareMilestone> milestones
    ) {}

    private PlanTemplate codebaseAnalysisTemplate() {
        boolean trello = flags.hasTrello();
        return new PlanTemplate("Codebase analysis with improvement recommendations",
                Complexity.EXPLORATORY, Effort.SUBSTANTIAL, true, List.of(
                new ToolAwareMilestone("explore_structure", "Explore project structure and identify key directories",
                        List.of("execute_bash"),
                        "Use `find`, `tree`, or `ls -la` to map directory structure. Look for src/, lib/, tests/, docs/"),
                new ToolAwareMilestone("identify_entry_points", "Identify main entry points and configuration files",
                        List.of("execute_bash"),
                        "Find build files, entry points and key configuration. Read the important configs."),
                new ToolAwareMilestone("analyze_architecture", "Analyze code architecture and patterns",
                        List.of("execute_bash"),
                        "Use grep to find patterns: classes, interfaces, exports. Map dependencies between modules."),
                new ToolAwareMilestone("identify_improvements", "Identify areas for improvement",
                        List.of("execute_bash"),
                        "Look for: TODOs, FIXMEs, deprecated code, large files, complex functions, missing tests."),
                new ToolAwareMilestone("prioritize_recommendations", "Prioritize and document recommendations",
                        trello ? List.of("trello_create_card", "trello_add_checklist") : List.of("execute_bash"),
                        trello
                                ? "Create Trello cards for each recommendation with priority labels and checklists."
                                : "Document findings in a structured format."),
                new ToolAwareMilestone("present_findings", "Present comprehensive analysis to user",
                        List.of(), "Synthesize findings into clear, actionable report.")
        ));
    }

    private PlanTemplate deploymentTemplate() {
        return new PlanTemplate("Deployment to Hetzner VPS", Complexity.COMPLEX, Effort.MEDIUM, false, List.of(
                new ToolAwareMilestone("check_prerequisites", "Check deployment prerequisites and current state",
                        List.of("list_containers", "execute_bash"),
                        "List current containers, check git status, verify build readiness."),
                new ToolAwareMilestone("prepare_build", "Prepare and validate build artifacts",
                        List.of("execute_bash"), "Run build commands, check for errors, validate output."),
                new ToolAwareMilestone("deploy", "Execute deployment to target environment",
                        List.of("deploy_to_hetzner"),
                        "Deploy container with appropriate config, env vars, and port mappings."),
                new ToolAwareMilestone("verify_deployment", "Verify deployment success and health",
                        List.of("get_container_logs", "get_container_stats"),
                        "Check logs for errors, verify container is running, test endpoints."),
                new ToolAwareMilestone("report_status", "Report deployment status and next steps",
                        flags.hasTrello() ? List.of("trello_update_card") : List.of(),
                        "Update any related Trello cards, notify user of success/failure.")
        ));
    }

    private PlanTemplate taskManagementTemplate() {
        return new PlanTemplate("Trello task management", Complexity.MODERATE, Effort.QUICK, false, List.of(
                new ToolAwareMilestone("understand_requirements", "Understand task requirements and context",
                        List.of("trello_list_boards", "trello_list_cards"),
                        "List existing boards and cards to understand current state."),
                new ToolAwareMilestone("execute_changes", "Execute requested Trello changes",
                        List.of("trello_create_card", "trello_update_card", "trello_add_checklist"),
                        "Create/update cards, add checklists, organize as requested."),
                new ToolAwareMilestone("verify_results", "Verify changes were applied correctly",
                        List.of("trello_list_cards", "trello_search_cards"),
                        "Query Trello to confirm changes are visible.")
        ));
    }

    private PlanTemplate implementationTemplate() {
        boolean canDelegate = flags.hasClaudeContainers();
        boolean trello = flags.hasTrello();
        return new PlanTemplate("Feature implementation", Complexity.COMPLEX, Effort.SUBSTANTIAL, true, List.of(
                new ToolAwareMilestone("analyze_requirements", "Analyze implementation requirements",
                        List.of("execute_bash"),
                        "Explore existing code, understand patterns, identify integration points."),
                new ToolAwareMilestone("plan_implementation", "Plan implementation approach",
                        trello ? List.of("trello_create_card", "trello_add_checklist") : List.of(),
                        "Break down into subtasks, create tracking cards with checklists."),
                new ToolAwareMilestone("implement", "Implement the feature/changes",
                        canDelegate ? List.of("spawn_claude_agent") : List.of("execute_bash"),
                        canDelegate
                                ? "Spawn Claude agent for complex implementation. Agent runs autonomously with full coding capabilities."
                                : "Implement directly using bash commands to create/modify files.",
                        canDelegate),
                new ToolAwareMilestone("monitor_progress", "Monitor implementation progress",
                        canDelegate ? List.of("get_claude_status", "get_claude_output") : List.of(),
                        canDelegate
                                ? "Monitor spawned agent progress, check output for issues."
                                : "N/A - implementation is synchronous."),
                new ToolAwareMilestone("verify_and_test", "Verify implementation and run tests",
                        List.of("execute_bash"), "Run tests, check for errors, validate functionality."),
                new ToolAwareMilestone("update_tracking", "Update task tracking and report results",
                        trello ? List.of("trello_update_card", "trello_add_comment") : List.of(),
                        "Mark cards complete, add implementation notes.")
        ));
    }

    private PlanTemplate explorationTemplate(String task, List<ToolCapability> bestTools) {
        List<String> primary = bestTools.stream().limit(3).map(ToolCapability::name).toList();
        if (primary.isEmpty()) {
            primary = List.of("execute_bash");
        }
        String summary = task.length() <= 100 ? task : task.substring(0, 100);
        return new PlanTemplate(summary, Complexity.MODERATE, Effort.MEDIUM, true, List.of(
                new ToolAwareMilestone("understand_request", "Understand the request and gather context",
                        List.of("execute_bash"), "Explore relevant files and gather information needed."),
                new ToolAwareMilestone("execute_task", "Execute the requested task",
                        primary, "Use " + String.join(", ", primary) + " as primary tools."),
                new ToolAwareMilestone("verify_and_report", "Verify results and report to user",
                        List.of(), "Confirm task completion and present results.")
        ));
    }
}
