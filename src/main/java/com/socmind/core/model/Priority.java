package com.socmind.core.model;

import java.util.Locale;

public enum Priority {
    P1, P2, P3, P4, P5;

    public static Priority fromWire(String value) {
        return Priority.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
