package com.socmind.core.model;

/**
 * Coarse risk classification derived from a triage risk score.
 * Declaration order is the tier order: LOW &lt; MEDIUM &lt; HIGH.
 */
public enum RiskTier {
    LOW,
    MEDIUM,
    HIGH
}
