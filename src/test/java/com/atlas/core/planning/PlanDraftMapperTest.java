package com.atlas.core.planning;

import com.atlas.core.llm.LlmParseException;
import com.atlas.core.model.Complexity;
import com.atlas.core.model.Effort;
import com.atlas.core.model.ExecutionPlan;
import com.atlas.core.model.Milestone;
import com.atlas.core.model.PlanDraft;
import com.atlas.core.model.PlanDraft.MilestoneDraft;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanDraftMapperTest {

    private static MilestoneDraft m(String id, String description) {
        return new MilestoneDraft(id, description, false);
    }

    @Test
    @DisplayName("valid draft maps field for field")
    void validDraft() {
        var draft = new PlanDraft("Add auth", "Complex", "medium", true,
                List.of(m("design", "Design the schema"), m("build", "Build it")));

        ExecutionPlan plan = PlanDraftMapper.toPlan(draft, "add auth");

        assertEquals("Add auth", plan.taskSummary());
        assertEquals(Complexity.COMPLEX, plan.complexity());
        assertEquals(Effort.MEDIUM, plan.estimatedEffort());
        assertTrue(plan.explorationNeeded());
        assertEquals(List.of("design", "build"), plan.milestones().stream().map(Milestone::getId).toList());
        assertFalse(plan.milestones().get(0).isCompleted());
    }

    @Test
    @DisplayName("unknown vocabulary is repaired to exploratory and substantial")
    void unknownVocabulary() {
        var draft = new PlanDraft("x", "very hard", "forever", null, List.of(m("a", "Do a")));

        ExecutionPlan plan = PlanDraftMapper.toPlan(draft, "x");

        assertEquals(Complexity.EXPLORATORY, plan.complexity());
        assertEquals(Effort.SUBSTANTIAL, plan.estimatedEffort());
        assertTrue(plan.explorationNeeded(), "missing flag follows exploratory complexity");
    }

    @Test
    @DisplayName("missing and duplicate ids are regenerated")
    void repairsIds() {
        var draft = new PlanDraft("x", "simple", "quick", false,
                List.of(m(null, "First"), m("check", "Second"), m("check", "Third"), m("  ", "Fourth")));

        ExecutionPlan plan = PlanDraftMapper.toPlan(draft, "x");

        assertEquals(List.of("step_1", "check", "check_2", "step_4"),
                plan.milestones().stream().map(Milestone::getId).toList());
    }

    @Test
    @DisplayName("milestones without description are dropped")
    void dropsBlankDescriptions() {
        var draft = new PlanDraft("x", "simple", "quick", false,
                Arrays.asList(m("a", ""), null, m("b", "Keep me")));

        ExecutionPlan plan = PlanDraftMapper.toPlan(draft, "x");

        assertEquals(1, plan.milestones().size());
        assertEquals("b", plan.milestones().get(0).getId());
    }

    @Test
    @DisplayName("blank summary falls back to the truncated task")
    void blankSummary() {
        String task = "t".repeat(150);
        var draft = new PlanDraft(" ", "simple", "quick", false, List.of(m("a", "Do a")));

        assertEquals("t".repeat(100), PlanDraftMapper.toPlan(draft, task).taskSummary());
    }

    @Test
    @DisplayName("draft without usable milestones is rejected")
    void noMilestones() {
        assertThrows(LlmParseException.class,
                () -> PlanDraftMapper.toPlan(new PlanDraft("x", "simple", "quick", false, List.of()), "x"));
        assertThrows(LlmParseException.class,
                () -> PlanDraftMapper.toPlan(new PlanDraft("x", "simple", "quick", false, null), "x"));
        assertThrows(LlmParseException.class, () -> PlanDraftMapper.toPlan(null, "x"));
    }
}
