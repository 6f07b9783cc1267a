package com.socmind.core.model;

import java.util.Locale;

/**
 * Recommendation a provider attaches to its response.
 */
public enum AgentDecision {
    ESCALATE,
    INVESTIGATE,
    MONITOR,
    DISMISS;

    public static AgentDecision fromWire(String value) {
        return AgentDecision.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Two recommendations conflict when one asks for escalation and the other dismisses.
     */
    public boolean conflictsWith(AgentDecision other) {
        return (this == ESCALATE && other == DISMISS) || (this == DISMISS && other == ESCALATE);
    }
}
