package com.atlas.core.tracking;

import com.atlas.core.model.ExecutionPlan;
import com.atlas.core.model.Milestone;
import com.atlas.core.model.PlanProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tracks milestone completion for one plan while it is being executed.
 * <p>
 * A tracker owns its plan's milestones for the duration of execution and is not
 * thread-safe. Completion is forward-only: a milestone that has been completed
 * stays completed.
 */
public class PlanTracker {

    private static final Logger log = LoggerFactory.getLogger(PlanTracker.class);

    private final ExecutionPlan plan;
    private final Clock clock;
    private final Instant startedAt;

    public PlanTracker(ExecutionPlan plan) {
        this(plan, Clock.systemUTC());
    }

    public PlanTracker(ExecutionPlan plan, Clock clock) {
        this.plan = plan;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    /**
     * Marks the milestone with the given id as completed.
     *
     * @return {@code true} if the id exists (including when it was already
     *         completed), {@code false} for an unknown id
     */
    public boolean completeMilestone(String milestoneId) {
        Optional<Milestone> milestone = plan.milestones().stream()
                .filter(m -> m.getId().equals(milestoneId))
                .findFirst();
        if (milestone.isEmpty()) {
            log.debug("Ignoring completion of unknown milestone '{}'", milestoneId);
            return false;
        }
        if (milestone.get().markCompleted()) {
            log.info("✅ Milestone completed: {}", milestone.get().getDescription());
        }
        return true;
    }

    public Optional<Milestone> nextMilestone() {
        return plan.milestones().stream().filter(m -> !m.isCompleted()).findFirst();
    }

    public PlanProgress progress() {
        List<Milestone> remaining = new ArrayList<>();
        int completed = 0;
        for (Milestone m : plan.milestones()) {
            if (m.isCompleted()) {
                completed++;
            } else {
                remaining.add(m);
            }
        }
        int total = plan.milestones().size();
        int percentage = (int) Math.round(completed * 100.0 / total);
        return new PlanProgress(completed, total, percentage, remaining);
    }

    public boolean isComplete() {
        return plan.milestones().stream().allMatch(Milestone::isCompleted);
    }

    /** Two-line progress notice suitable for posting to a chat channel. */
    public String progressString() {
        PlanProgress p = progress();
        long elapsed = Math.round(Duration.between(startedAt, clock.instant()).toMillis() / 1000.0);
        return "📊 **Progress: " + p.percentage() + "%** (" + p.completed() + "/" + p.total() + " milestones)\n"
                + "⏱️ Elapsed: " + elapsed + "s";
    }

    public String detailedStatus() {
        var lines = new ArrayList<String>();
        lines.add("📋 Plan Status:");
        List<Milestone> milestones = plan.milestones();
        for (int i = 0; i < milestones.size(); i++) {
            Milestone m = milestones.get(i);
            lines.add("   " + (m.isCompleted() ? "✅" : "⬜") + " " + (i + 1) + ". " + m.getDescription());
        }
        return String.join("\n", lines);
    }
}
