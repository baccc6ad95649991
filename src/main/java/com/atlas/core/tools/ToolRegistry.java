package com.atlas.core.tools;

import com.atlas.core.model.Integration;
import com.atlas.core.model.ToolCapability;
import com.atlas.core.model.ToolCategory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Static catalogue of the tools the executor can call. Read-only after
 * construction; declaration order is the tie-break order for tool ranking.
 */
@Component
public class ToolRegistry {

    private static final List<ToolCapability> TOOLS = List.of(
            new ToolCapability("execute_bash", ToolCategory.EXPLORATION, Integration.CORE,
                    "Execute shell commands for file operations, git, npm, etc.",
                    List.of("explore", "find", "search", "list", "read", "analyze", "git", "npm", "file", "directory", "code")),

            new ToolCapability("trello_list_boards", ToolCategory.EXPLORATION, Integration.TRELLO,
                    "List all Trello boards",
                    List.of("trello", "boards", "projects", "tasks"), List.of("trello_api_key")),
            new ToolCapability("trello_list_cards", ToolCategory.EXPLORATION, Integration.TRELLO,
                    "List cards on a Trello board",
                    List.of("cards", "board", "backlog"), List.of("trello_api_key")),
            new ToolCapability("trello_search_cards", ToolCategory.EXPLORATION, Integration.TRELLO,
                    "Search Trello cards by text",
                    List.of("search", "lookup"), List.of("trello_api_key")),
            new ToolCapability("trello_create_card", ToolCategory.CREATION, Integration.TRELLO,
                    "Create task cards on Trello",
                    List.of("task", "card", "todo", "create", "track", "plan"), List.of("trello_api_key")),
            new ToolCapability("trello_add_checklist", ToolCategory.CREATION, Integration.TRELLO,
                    "Add checklists to cards",
                    List.of("checklist", "steps", "subtasks", "breakdown"), List.of("trello_api_key")),
            new ToolCapability("trello_update_card", ToolCategory.MODIFICATION, Integration.TRELLO,
                    "Update card status, move between lists",
                    List.of("update", "move", "status", "progress"), List.of("trello_api_key")),
            new ToolCapability("trello_add_comment", ToolCategory.MODIFICATION, Integration.TRELLO,
                    "Add a comment to a Trello card",
                    List.of("comment", "annotate"), List.of("trello_api_key")),

            new ToolCapability("deploy_to_hetzner", ToolCategory.DEPLOYMENT, Integration.HETZNER,
                    "Deploy Docker containers to VPS",
                    List.of("deploy", "ship", "release", "docker", "container", "server"), List.of("hetzner_ssh_key")),
            new ToolCapability("list_containers", ToolCategory.MONITORING, Integration.HETZNER,
                    "List running containers",
                    List.of("containers", "running", "status", "list"), List.of("hetzner_ssh_key")),
            new ToolCapability("get_container_logs", ToolCategory.MONITORING, Integration.HETZNER,
                    "Get container logs",
                    List.of("logs", "debug", "errors", "output"), List.of("hetzner_ssh_key")),
            new ToolCapability("get_container_stats", ToolCategory.MONITORING, Integration.HETZNER,
                    "Get container CPU and memory usage",
                    List.of("stats", "cpu", "memory", "usage"), List.of("hetzner_ssh_key")),
            new ToolCapability("restart_container", ToolCategory.MODIFICATION, Integration.HETZNER,
                    "Restart a container",
                    List.of("restart", "refresh", "reset"), List.of("hetzner_ssh_key")),
            new ToolCapability("delete_container", ToolCategory.MODIFICATION, Integration.HETZNER,
                    "Stop and remove a container",
                    List.of("teardown", "decommission"), List.of("hetzner_ssh_key")),

            new ToolCapability("spawn_claude_agent", ToolCategory.DELEGATION, Integration.CLAUDE_CONTAINERS,
                    "Spawn autonomous Claude agent for complex subtasks",
                    List.of("complex", "implement", "build", "create", "refactor", "autonomous", "coding")),
            new ToolCapability("get_claude_status", ToolCategory.MONITORING, Integration.CLAUDE_CONTAINERS,
                    "Monitor spawned agent progress",
                    List.of("status", "progress", "agent", "monitor")),
            new ToolCapability("get_claude_output", ToolCategory.MONITORING, Integration.CLAUDE_CONTAINERS,
                    "Read the output of a spawned agent",
                    List.of("transcript")),
            new ToolCapability("wait_for_claude_agent", ToolCategory.MONITORING, Integration.CLAUDE_CONTAINERS,
                    "Wait for agent completion",
                    List.of("wait", "complete", "finish", "result"))
    );

    public List<ToolCapability> all() {
        return TOOLS;
    }
}
