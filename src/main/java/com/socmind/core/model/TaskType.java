package com.socmind.core.model;

import java.util.Locale;

/**
 * Kind of security work submitted to the engine.
 */
public enum TaskType {
    ALERT_ANALYSIS,
    THREAT_HUNT,
    INCIDENT_RESPONSE,
    THREAT_BRIEF;

    /** Wire name, e.g. {@code alert_analysis}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses either the wire name ({@code threat_hunt}) or the enum name ({@code THREAT_HUNT}).
     *
     * @throws IllegalArgumentException if the value names no task type
     */
    public static TaskType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Task type is required");
        }
        return TaskType.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
