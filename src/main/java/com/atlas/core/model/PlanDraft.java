package com.atlas.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Plan exactly as the LLM returned it. Every field is optional and the
 * vocabularies are not checked; {@code PlanDraftMapper} turns a draft into a
 * valid {@link ExecutionPlan}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanDraft(
    String taskSummary,
    String complexity,
    String estimatedEffort,
    Boolean explorationNeeded,
    List<MilestoneDraft> milestones
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MilestoneDraft(
        String id,
        String description,
        Boolean completed
    ) {}
}
