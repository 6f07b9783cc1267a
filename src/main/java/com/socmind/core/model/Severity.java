package com.socmind.core.model;

import java.util.Locale;

/**
 * Alert severity as reported by the detection source, most severe first.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFORMATIONAL;

    public static Severity fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity is required");
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isAtLeast(Severity other) {
        return ordinal() <= other.ordinal();
    }
}
