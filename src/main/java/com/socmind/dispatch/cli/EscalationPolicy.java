package com.socmind.dispatch.cli;

import com.socmind.core.engine.OrchestrationEngine;
import com.socmind.core.model.EscalationReason;
import com.socmind.core.model.HumanDecision;
import com.socmind.core.state.TaskState;

/**
 * What an unattended CLI run does when a task halts for review.
 */
enum EscalationPolicy {
    /** Leave the task halted and report the escalation. */
    NONE,
    PROCEED,
    ABORT;

    private static final int MAX_DECISIONS = 10;

    /**
     * Applies this policy until the task terminates, stays halted or no decision fits.
     */
    TaskState settle(OrchestrationEngine engine, TaskState state, String reviewer) {
        int decisions = 0;
        while (this != NONE && state.status().isHalted() && decisions < MAX_DECISIONS) {
            var escalation = state.escalation().orElse(null);
            if (escalation == null) {
                return state;
            }
            ConsoleOutput.escalation(escalation);
            if (this == PROCEED && escalation.reason() == EscalationReason.UNEVALUABLE_DECISION) {
                ConsoleOutput.warn("Cannot proceed past " + escalation.triggeringStep()
                        + " without a condition outcome; leaving the task halted");
                return state;
            }
            var decision = this == PROCEED
                    ? HumanDecision.proceed(reviewer, "Unattended CLI run")
                    : HumanDecision.abort(reviewer, "Unattended CLI run");
            ConsoleOutput.info(decision.type() + " by " + reviewer);
            state = engine.resolve(state.taskId(), decision).join();
            decisions++;
        }
        return state;
    }
}
