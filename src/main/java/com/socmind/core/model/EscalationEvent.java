package com.socmind.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A request for human review. Raised by the escalation gate; blocks new dispatch for
 * the task until a {@link HumanDecision} is recorded.
 *
 * @param id              event id
 * @param taskId          task the event belongs to
 * @param reason          trigger that fired
 * @param triggeringStep  step id (or decision point id) that caused it
 * @param severity        severity presented to the reviewer
 * @param detail          human-readable explanation
 * @param raisedAt        when it was raised
 */
public record EscalationEvent(
    String id,
    String taskId,
    EscalationReason reason,
    String triggeringStep,
    Severity severity,
    String detail,
    Instant raisedAt
) implements Serializable {

    /** Identity of the cause, used to keep an acknowledged trigger from firing again. */
    public String triggerKey() {
        return reason.name() + ":" + triggeringStep;
    }
}
