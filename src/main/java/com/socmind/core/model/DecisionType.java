package com.socmind.core.model;

import java.util.Locale;

public enum DecisionType {
    PROCEED,
    ABORT,
    MODIFY_PLAN;

    public static DecisionType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Decision type is required");
        }
        return DecisionType.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
