package com.atlas.core.tools;

import com.atlas.core.model.Integration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IntegrationPropertiesTest {

    @Test
    @DisplayName("all integrations are enabled by default")
    void defaults() {
        IntegrationFlags flags = new IntegrationProperties().toFlags();
        assertEquals(IntegrationFlags.all(), flags);
    }

    @Test
    @DisplayName("core is always enabled")
    void coreAlwaysOn() {
        var props = new IntegrationProperties();
        props.setTrello(false);
        props.setHetzner(false);
        props.setClaudeContainers(false);

        IntegrationFlags flags = props.toFlags();
        assertTrue(flags.isEnabled(Integration.CORE));
        assertFalse(flags.isEnabled(Integration.TRELLO));
        assertFalse(flags.isEnabled(Integration.HETZNER));
        assertFalse(flags.isEnabled(Integration.CLAUDE_CONTAINERS));
    }

    @Test
    @DisplayName("ToolsConfig builds the planner from the configured flags")
    void toolsConfig() {
        var props = new IntegrationProperties();
        props.setHetzner(false);

        ToolAwarePlanner planner = new ToolsConfig().toolAwarePlanner(new ToolRegistry(), props, null);

        assertTrue(planner.isAvailable("trello_list_boards"));
        assertFalse(planner.isAvailable("deploy_to_hetzner"));
    }
}
