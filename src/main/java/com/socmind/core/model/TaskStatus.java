package com.socmind.core.model;

/**
 * Lifecycle states of a task.
 */
public enum TaskStatus {
    RECEIVED,
    TRIAGE_CHECK,
    TRIAGE_PENDING,
    TRIAGE_DONE,
    PLANNING,
    DISPATCHING,
    STEP_AWAITING,
    SYNTHESIZING,
    DONE,
    ESCALATED,
    AWAITING_INFORMATION,
    ESCALATED_RESOLVED,
    ABORTED;

    public boolean isTerminal() {
        return this == DONE || this == ESCALATED_RESOLVED || this == ABORTED;
    }

    /** States in which the task waits for a human and no graph run is active. */
    public boolean isHalted() {
        return this == ESCALATED || this == AWAITING_INFORMATION;
    }
}
