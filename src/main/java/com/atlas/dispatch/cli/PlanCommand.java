package com.atlas.dispatch.cli;

import com.atlas.core.model.ExecutionPlan;
import com.atlas.core.model.PlanningContext;
import com.atlas.core.model.ToolAwarePlan;
import com.atlas.core.planning.ExecutionPlanner;
import com.atlas.core.tools.ToolAwarePlanner;
import com.atlas.core.tracking.PlanTracker;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: atlas plan "&lt;task&gt;"
 * <p>
 * Plans a task without classifying it first. By default the AI execution
 * planner is used (quick heuristics first, the model otherwise); with
 * {@code --tool-aware} the plan is built from tool templates and never calls
 * the model.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Create an execution plan for a task")
@Component
public class PlanCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language task description")
    private String task;

    @Option(names = {"--tool-aware", "-t"}, description = "Plan with tool routing and delegation hints")
    private boolean toolAware;

    @Option(names = {"--findings", "-f"}, description = "Findings from earlier exploration")
    private String findings;

    @Option(names = "--tool", description = "Tool available to the executor (repeatable)")
    private List<String> tools = new ArrayList<>();

    @Option(names = {"--constraint", "-c"}, description = "Constraint the plan must respect (repeatable)")
    private List<String> constraints = new ArrayList<>();

    @Option(names = "--json", description = "Print the plan as JSON")
    private boolean json;

    private final ExecutionPlanner executionPlanner;
    private final ToolAwarePlanner toolAwarePlanner;

    public PlanCommand(ExecutionPlanner executionPlanner, ToolAwarePlanner toolAwarePlanner) {
        this.executionPlanner = executionPlanner;
        this.toolAwarePlanner = toolAwarePlanner;
    }

    @Override
    public void run() {
        if (toolAware) {
            ToolAwarePlan plan = toolAwarePlanner.createPlan(task);
            if (json) {
                System.out.println(CliJson.write(plan));
                return;
            }
            ConsoleOutput.printBanner();
            System.out.println(toolAwarePlanner.renderRecommendation(plan));
            plan.delegationOpportunities().forEach(ConsoleOutput::delegation);
            return;
        }

        ExecutionPlan plan = executionPlanner.createPlan(
                new PlanningContext(task, findings, tools, constraints));
        if (json) {
            System.out.println(CliJson.write(plan));
            return;
        }
        ConsoleOutput.printBanner();
        ConsoleOutput.plan(plan);
        System.out.println();
        System.out.println(new PlanTracker(plan).detailedStatus());
    }
}
