package com.socmind.core.model;

public enum EscalationReason {
    CRITICAL_CONTAINMENT,
    DECISION_CONFLICT,
    UNEVALUABLE_DECISION,
    MISSING_RISK_SCORE,
    PROVIDER_TIMEOUT,
    PROVIDER_UNAVAILABLE,
    MALFORMED_RESPONSE,
    AGGREGATE_WAIT_EXCEEDED;

    public static EscalationReason forFailure(ProviderFailure failure) {
        return switch (failure) {
            case TIMEOUT -> PROVIDER_TIMEOUT;
            case UNAVAILABLE, NOT_REGISTERED -> PROVIDER_UNAVAILABLE;
            case MALFORMED_RESPONSE -> MALFORMED_RESPONSE;
        };
    }
}
