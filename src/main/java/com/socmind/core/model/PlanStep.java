package com.socmind.core.model;

import java.io.Serializable;

/**
 * One provider invocation in a plan.
 *
 * @param id            step id, unique within the plan (e.g. "S1")
 * @param agentId       provider the step routes to
 * @param action        action requested (e.g. "contain", "enrich")
 * @param rationale     why the step is in the plan
 * @param parallelGroup steps sharing a group number are dispatched together; null for a solo step
 */
public record PlanStep(
    String id,
    AgentId agentId,
    String action,
    String rationale,
    Integer parallelGroup
) implements Serializable {

    public static final String CONTAIN = "contain";

    public boolean isContainment() {
        return agentId == AgentId.RESPONSE && CONTAIN.equalsIgnoreCase(action);
    }

    public boolean sharesGroupWith(PlanStep other) {
        return parallelGroup != null && parallelGroup.equals(other.parallelGroup);
    }
}
