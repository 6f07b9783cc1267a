package com.socmind.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered plan of provider steps with the decision points that prune it.
 *
 * @param steps          steps in plan order
 * @param decisionPoints unresolved decision points
 * @param note           disposition note (e.g. "record + monitor" for an empty plan)
 * @param revision       0 for a built plan, incremented by every narrowing or replacement
 */
public record Plan(
    List<PlanStep> steps,
    List<DecisionPoint> decisionPoints,
    String note,
    int revision
) implements Serializable {

    public Plan {
        steps = steps == null ? List.of() : List.copyOf(steps);
        decisionPoints = decisionPoints == null ? List.of() : List.copyOf(decisionPoints);
        note = note == null ? "" : note;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public Optional<PlanStep> step(String stepId) {
        return steps.stream().filter(s -> s.id().equals(stepId)).findFirst();
    }

    public Optional<DecisionPoint> decisionPoint(String id) {
        return decisionPoints.stream().filter(dp -> dp.id().equals(id)).findFirst();
    }

    /** True if some unresolved decision point still has to choose whether {@code stepId} runs. */
    public boolean isGuarded(String stepId) {
        return decisionPoints.stream().anyMatch(dp -> dp.guards(stepId));
    }

    /**
     * Resolves {@code decisionPointId} with {@code outcome}: drops the untaken branch's steps,
     * the resolved decision point, and every decision point that follows a dropped step.
     */
    public Plan resolve(String decisionPointId, boolean outcome) {
        var dp = decisionPoint(decisionPointId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown decision point " + decisionPointId));
        Set<String> dropped = new HashSet<>(dp.untaken(outcome));
        var keptSteps = steps.stream().filter(s -> !dropped.contains(s.id())).toList();
        var keptPoints = decisionPoints.stream()
                .filter(p -> !p.id().equals(decisionPointId))
                .filter(p -> !dropped.contains(p.afterStepId()))
                .toList();
        return new Plan(keptSteps, keptPoints, note, revision + 1);
    }

    /** Replaces every step not yet completed, as a human Modify-plan decision does. */
    public Plan replaceRemaining(Set<String> completedStepIds, List<PlanStep> replacementSteps,
                                 List<DecisionPoint> replacementPoints, String replacementNote) {
        var kept = new ArrayList<>(
                steps.stream().filter(s -> completedStepIds.contains(s.id())).toList());
        kept.addAll(replacementSteps);
        return new Plan(kept, replacementPoints, replacementNote == null ? note : replacementNote, revision + 1);
    }
}
