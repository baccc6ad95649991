package com.atlas.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("Milestone")
    class MilestoneTests {

        @Test
        @DisplayName("markCompleted reports only the first transition")
        void markCompleted() {
            var m = new Milestone("a", "A");
            assertFalse(m.isCompleted());
            assertTrue(m.markCompleted());
            assertFalse(m.markCompleted());
            assertTrue(m.isCompleted());
        }

        @Test
        @DisplayName("blank id is rejected")
        void blankId() {
            assertThrows(IllegalArgumentException.class, () -> new Milestone(" ", "x"));
            assertThrows(IllegalArgumentException.class, () -> new Milestone(null, "x"));
        }
    }

    @Nested
    @DisplayName("ExecutionPlan")
    class ExecutionPlanTests {

        @Test
        @DisplayName("empty milestone list is rejected")
        void emptyMilestones() {
            assertThrows(IllegalArgumentException.class,
                    () -> new ExecutionPlan("x", Complexity.SIMPLE, Effort.QUICK, false, List.of()));
        }

        @Test
        @DisplayName("duplicate milestone ids are rejected")
        void duplicateIds() {
            assertThrows(IllegalArgumentException.class,
                    () -> new ExecutionPlan("x", Complexity.SIMPLE, Effort.QUICK, false,
                            List.of(new Milestone("a", "1"), new Milestone("a", "2"))));
        }

        @Test
        @DisplayName("tool-aware view shares milestone instances")
        void toolAwareView() {
            var m = new ToolAwareMilestone("a", "A", List.of("execute_bash"), null);
            var plan = new ToolAwarePlan("x", Complexity.SIMPLE, Effort.QUICK, false, List.of(m),
                    List.of("execute_bash"), null);

            plan.asExecutionPlan().milestones().get(0).markCompleted();

            assertTrue(m.isCompleted());
            assertTrue(plan.delegationOpportunities().isEmpty());
        }
    }

    @Nested
    @DisplayName("Vocabularies")
    class Vocabularies {

        @Test
        @DisplayName("fromWire is case-insensitive and empty for unknown values")
        void fromWire() {
            assertEquals(Optional.of(Complexity.EXPLORATORY), Complexity.fromWire(" Exploratory "));
            assertEquals(Optional.of(Effort.QUICK), Effort.fromWire("QUICK"));
            assertTrue(Complexity.fromWire("impossible").isEmpty());
            assertTrue(Effort.fromWire(null).isEmpty());
        }

        @Test
        @DisplayName("tool score counts matching keywords")
        void toolScore() {
            var tool = new ToolCapability("t", ToolCategory.EXPLORATION, Integration.CORE, "d",
                    List.of("Deploy", "server", "deploy"));
            assertEquals(List.of("deploy", "server"), tool.bestFor());
            assertEquals(2, tool.score("deploy to the server"));
            assertEquals(0, tool.score("nothing here"));
        }
    }

    @Test
    @DisplayName("conversation messages read from JSON with wire-name roles")
    void conversationMessageJson() throws Exception {
        var mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        var message = mapper.readValue("""
                {"role":"assistant","content":"done","timestamp":"2026-03-01T12:00:00Z"}
                """, ConversationMessage.class);

        assertEquals(Role.ASSISTANT, message.role());
        assertEquals("done", message.content());
        assertEquals(Instant.parse("2026-03-01T12:00:00Z"), message.timestamp());
        assertTrue(mapper.writeValueAsString(message).contains("\"role\":\"assistant\""));
    }
}
