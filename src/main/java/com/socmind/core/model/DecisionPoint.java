package com.socmind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A branch in a plan, evaluated by the engine once {@code afterStepId} has completed.
 *
 * @param id          decision point id (e.g. "D1")
 * @param condition   predicate to test
 * @param afterStepId step whose response the predicate reads
 * @param trueBranch  step ids kept when the predicate holds
 * @param falseBranch step ids kept when it does not
 */
public record DecisionPoint(
    String id,
    Condition condition,
    String afterStepId,
    List<String> trueBranch,
    List<String> falseBranch
) implements Serializable {

    public DecisionPoint {
        trueBranch = trueBranch == null ? List.of() : List.copyOf(trueBranch);
        falseBranch = falseBranch == null ? List.of() : List.copyOf(falseBranch);
    }

    public boolean guards(String stepId) {
        return trueBranch.contains(stepId) || falseBranch.contains(stepId);
    }

    /** Step ids discarded when the predicate evaluates to {@code outcome}. */
    public List<String> untaken(boolean outcome) {
        return outcome ? falseBranch : trueBranch;
    }
}
