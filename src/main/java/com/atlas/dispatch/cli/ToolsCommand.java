package com.atlas.dispatch.cli;

import com.atlas.core.model.ToolCapability;
import com.atlas.core.tools.ToolAwarePlanner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: atlas tools "&lt;task&gt;"
 * <p>
 * Lists the enabled tools ranked by keyword relevance to the task.
 */
@Command(name = "tools", mixinStandardHelpOptions = true, description = "Rank available tools for a task")
@Component
public class ToolsCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language task description")
    private String task;

    private final ToolAwarePlanner toolAwarePlanner;

    public ToolsCommand(ToolAwarePlanner toolAwarePlanner) {
        this.toolAwarePlanner = toolAwarePlanner;
    }

    @Override
    public void run() {
        List<ToolCapability> ranked = toolAwarePlanner.findBestTools(task);
        if (ranked.isEmpty()) {
            ConsoleOutput.info("No tool matches this task; "
                    + toolAwarePlanner.availableTools().size() + " tools are enabled.");
            return;
        }
        ConsoleOutput.info(ranked.size() + " relevant tool" + (ranked.size() != 1 ? "s" : "") + ":");
        String lower = task.toLowerCase();
        for (ToolCapability tool : ranked) {
            System.out.printf("  %-22s [%-12s] score=%d  %s%n", tool.name(),
                    tool.category().name().toLowerCase(), tool.score(lower), tool.description());
        }
    }
}
