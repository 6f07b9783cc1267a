package com.socmind.core.model;

public enum StepOutcome {
    SUCCEEDED,
    FAILED
}
