package com.atlas.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Atlas.
 * Routes to subcommands: classify, plan, tools, turn, summarize.
 */
@Command(
        name = "atlas",
        mixinStandardHelpOptions = true,
        version = "Atlas Planner 0.1.0",
        description = "Adaptive task planning engine for the Atlas agent",
        subcommands = {
                ClassifyCommand.class,
                PlanCommand.class,
                ToolsCommand.class,
                TurnCommand.class,
                SummarizeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AtlasCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
