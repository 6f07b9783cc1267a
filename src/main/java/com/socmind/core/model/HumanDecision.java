package com.socmind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A reviewer's resolution of a pending escalation.
 *
 * @param type                       Proceed, Abort or Modify-plan
 * @param reviewer                   who decided
 * @param note                       free-text justification
 * @param replacementSteps           remaining steps for Modify-plan
 * @param replacementDecisionPoints  decision points for the replacement steps
 * @param conditionOutcome           outcome of an unevaluable decision point; required when
 *                                   proceeding past one
 * @param decidedAt                  when the decision was recorded
 */
public record HumanDecision(
    DecisionType type,
    String reviewer,
    String note,
    List<PlanStep> replacementSteps,
    List<DecisionPoint> replacementDecisionPoints,
    Boolean conditionOutcome,
    Instant decidedAt
) implements Serializable {

    public HumanDecision {
        replacementSteps = replacementSteps == null ? List.of() : List.copyOf(replacementSteps);
        replacementDecisionPoints = replacementDecisionPoints == null ? List.of() : List.copyOf(replacementDecisionPoints);
        decidedAt = decidedAt == null ? Instant.now() : decidedAt;
    }

    public static HumanDecision proceed(String reviewer, String note) {
        return new HumanDecision(DecisionType.PROCEED, reviewer, note, null, null, null, null);
    }

    public static HumanDecision proceedWithOutcome(String reviewer, boolean outcome) {
        return new HumanDecision(DecisionType.PROCEED, reviewer, null, null, null, outcome, null);
    }

    public static HumanDecision abort(String reviewer, String note) {
        return new HumanDecision(DecisionType.ABORT, reviewer, note, null, null, null, null);
    }

    public static HumanDecision modifyPlan(String reviewer, List<PlanStep> steps, List<DecisionPoint> points) {
        return new HumanDecision(DecisionType.MODIFY_PLAN, reviewer, null, steps, points, null, null);
    }
}
