package com.atlas.core.planning;

import com.atlas.core.llm.LlmParseException;
import com.atlas.core.model.Complexity;
import com.atlas.core.model.Effort;
import com.atlas.core.model.ExecutionPlan;
import com.atlas.core.model.Milestone;
import com.atlas.core.model.PlanDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns an untrusted {@link PlanDraft} into a valid {@link ExecutionPlan}.
 * <p>
 * Out-of-vocabulary complexity becomes {@link Complexity#EXPLORATORY} and
 * out-of-vocabulary effort becomes {@link Effort#SUBSTANTIAL}. Milestones
 * without a description are dropped; missing or duplicate ids are
 * regenerated. A draft with no usable milestone is rejected.
 */
final class PlanDraftMapper {

    private static final Logger log = LoggerFactory.getLogger(PlanDraftMapper.class);

    private static final Pattern NON_ID_CHARS = Pattern.compile("[^a-z0-9_]+");

    private PlanDraftMapper() {}

    static ExecutionPlan toPlan(PlanDraft draft, String originalTask) {
        if (draft == null) {
            throw new LlmParseException("LLM returned a null plan");
        }

        Complexity complexity = Complexity.fromWire(draft.complexity()).orElseGet(() -> {
            log.warn("Unknown complexity '{}' from LLM, using exploratory", draft.complexity());
            return Complexity.EXPLORATORY;
        });
        Effort effort = Effort.fromWire(draft.estimatedEffort()).orElseGet(() -> {
            log.warn("Unknown effort '{}' from LLM, using substantial", draft.estimatedEffort());
            return Effort.SUBSTANTIAL;
        });

        var milestones = new ArrayList<Milestone>();
        Set<String> usedIds = new HashSet<>();
        if (draft.milestones() != null) {
            for (var m : draft.milestones()) {
                if (m == null || m.description() == null || m.description().isBlank()) {
                    continue;
                }
                String id = uniqueId(normalizeId(m.id(), milestones.size() + 1), usedIds);
                milestones.add(new Milestone(id, m.description().trim()));
            }
        }
        if (milestones.isEmpty()) {
            throw new LlmParseException("LLM plan contained no usable milestones");
        }

        String summary = draft.taskSummary() != null && !draft.taskSummary().isBlank()
                ? draft.taskSummary().trim()
                : FallbackPlans.truncate(originalTask);
        boolean exploration = draft.explorationNeeded() != null
                ? draft.explorationNeeded()
                : complexity == Complexity.EXPLORATORY;

        return new ExecutionPlan(summary, complexity, effort, exploration, milestones);
    }

    private static String normalizeId(String raw, int position) {
        if (raw == null || raw.isBlank()) {
            return "step_" + position;
        }
        String id = NON_ID_CHARS.matcher(raw.trim().toLowerCase()).replaceAll("_");
        return id.isBlank() || id.chars().allMatch(c -> c == '_') ? "step_" + position : id;
    }

    private static String uniqueId(String candidate, Set<String> usedIds) {
        String id = candidate;
        int suffix = 2;
        while (!usedIds.add(id)) {
            id = candidate + "_" + suffix++;
        }
        return id;
    }
}
