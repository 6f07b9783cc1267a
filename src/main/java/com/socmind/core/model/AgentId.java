package com.socmind.core.model;

import java.util.Locale;

/**
 * Identifiers of the capability providers the engine can route work to.
 */
public enum AgentId {
    TRIAGE,
    HUNTING,
    RESPONSE,
    INTEL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AgentId fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Agent id is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.endsWith("-AGENT")) {
            normalized = normalized.substring(0, normalized.length() - "-AGENT".length());
        }
        return AgentId.valueOf(normalized);
    }
}
