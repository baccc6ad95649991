package com.atlas.dispatch.cli;

import com.atlas.core.model.ClassificationResult;
import com.atlas.core.model.ExecutionPlan;
import com.atlas.core.model.Milestone;
import com.atlas.core.model.ToolAwareMilestone;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Atlas CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ATLAS PLANNER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ATLAS]|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void classification(ClassificationResult result) {
        String color = result.shouldExecuteTask() ? "fg(green)" : "fg(blue)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Intent:|@ @|" + color + " " + result.intent().wireName() + "|@"
                + " (" + result.confidence().wireName() + " confidence)"));
        System.out.println("Reasoning: " + result.reasoning());
        System.out.println("Execute task: " + (result.shouldExecuteTask() ? "yes" : "no"));
        if (result.suggestedResponse() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(magenta) Reply:|@ " + result.suggestedResponse()));
        }
    }

    public static void plan(ExecutionPlan plan) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold PLAN|@ " + plan.taskSummary()));
        System.out.println("Complexity: " + plan.complexity().wireName()
                + " | Effort: " + plan.estimatedEffort().wireName()
                + " | Exploration: " + (plan.explorationNeeded() ? "yes" : "no"));
        System.out.println();
        System.out.println("MILESTONES:");
        for (Milestone m : plan.milestones()) {
            System.out.printf("  %-28s %s%n", m.getId(), m.getDescription());
            if (m instanceof ToolAwareMilestone tm && !tm.getSuggestedTools().isEmpty()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "  @|fg(blue) " + " ".repeat(28) + " tools: " + String.join(", ", tm.getSuggestedTools()) + "|@"));
            }
        }
    }

    public static void delegation(String opportunity) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(magenta) [DELEGATE]|@ " + opportunity));
    }
}
