package com.socmind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.socmind.core.model.AgentId;
import com.socmind.core.model.Condition;
import com.socmind.core.model.DecisionPoint;
import com.socmind.core.model.DecisionType;
import com.socmind.core.model.HumanDecision;
import com.socmind.core.model.PlanStep;

import java.util.List;
import java.util.Locale;

/**
 * Inbound JSON body for POST /api/v1/tasks/{id}/decision.
 *
 * @param type             proceed, abort or modify-plan
 * @param reviewer         who decided
 * @param note             free-text justification; nullable
 * @param steps            replacement steps for modify-plan; nullable
 * @param decisionPoints   decision points over the replacement steps; nullable
 * @param conditionOutcome outcome of an unevaluable decision point; nullable
 */
public record DecisionRequest(
    String type,
    String reviewer,
    String note,
    List<StepPayload> steps,
    @JsonProperty("decision_points") List<DecisionPointPayload> decisionPoints,
    @JsonProperty("condition_outcome") Boolean conditionOutcome
) {

    public record StepPayload(
        String id,
        String agent,
        String action,
        String rationale,
        @JsonProperty("parallel_group") Integer parallelGroup
    ) {}

    public record DecisionPointPayload(
        String id,
        String condition,
        @JsonProperty("after_step") String afterStep,
        @JsonProperty("true_branch") List<String> trueBranch,
        @JsonProperty("false_branch") List<String> falseBranch
    ) {}

    /**
     * @throws IllegalArgumentException if the type, an agent or a condition cannot be parsed
     */
    public HumanDecision toDecision() {
        if (reviewer == null || reviewer.isBlank()) {
            throw new IllegalArgumentException("Reviewer is required");
        }
        var decisionType = DecisionType.fromWire(type);
        var replacementSteps = steps == null ? List.<PlanStep>of() : steps.stream()
                .map(s -> new PlanStep(s.id(), AgentId.fromWire(s.agent()), s.action(), s.rationale(),
                        s.parallelGroup()))
                .toList();
        var replacementPoints = decisionPoints == null ? List.<DecisionPoint>of() : decisionPoints.stream()
                .map(d -> new DecisionPoint(d.id(), parseCondition(d.condition()), d.afterStep(),
                        d.trueBranch(), d.falseBranch()))
                .toList();
        if (decisionType == DecisionType.MODIFY_PLAN && replacementSteps.isEmpty()) {
            throw new IllegalArgumentException("modify-plan requires replacement steps");
        }
        return new HumanDecision(decisionType, reviewer, note, replacementSteps, replacementPoints,
                conditionOutcome, null);
    }

    private static Condition parseCondition(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Decision point condition is required");
        }
        return Condition.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
