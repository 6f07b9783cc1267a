package com.socmind.core.model;

/**
 * Classified provider failure, as surfaced by the provider contract.
 */
public enum ProviderFailure {
    TIMEOUT,
    UNAVAILABLE,
    MALFORMED_RESPONSE,
    NOT_REGISTERED;

    /** Transient failures are retried once before escalating. */
    public boolean isTransient() {
        return this == TIMEOUT || this == UNAVAILABLE;
    }
}
