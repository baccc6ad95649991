package com.atlas.dispatch.cli;

import com.atlas.core.engine.PlanningEngine;
import com.atlas.core.engine.TurnDecision;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: atlas turn "&lt;message&gt;"
 * <p>
 * Handles a message the way the agent would: classify, then either reply or plan.
 */
@Command(name = "turn", mixinStandardHelpOptions = true,
        description = "Handle a message end to end: classify, then reply or plan")
@Component
public class TurnCommand implements Runnable {

    @Parameters(index = "0", description = "Inbound message")
    private String message;

    @Option(names = {"--tool-aware", "-t"}, description = "Plan tasks with tool routing")
    private boolean toolAware;

    private final PlanningEngine planningEngine;

    public TurnCommand(PlanningEngine planningEngine) {
        this.planningEngine = planningEngine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        TurnDecision decision = planningEngine.handleMessage(message, toolAware);
        ConsoleOutput.info("Turn " + decision.turnId());
        ConsoleOutput.classification(decision.classification());
        decision.executionPlan().ifPresent(ConsoleOutput::plan);
        decision.toolPlan().ifPresent(p -> p.delegationOpportunities().forEach(ConsoleOutput::delegation));
    }
}
