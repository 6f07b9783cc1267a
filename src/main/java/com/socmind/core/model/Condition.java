package com.socmind.core.model;

/**
 * Predicates a decision point can test. Each reads the response recorded for the
 * decision point's producing step.
 */
public enum Condition {
    /** Intel decision is Escalate. */
    APT_CONFIRMED,
    /** Hunting reported non-blank findings. */
    FINDINGS_PRESENT,
    /** Hunting reported non-blank findings (threat-brief wording). */
    THREATS_FOUND,
    /** Triage risk score classifies as High. */
    HIGH_RISK,
    /** Intel decision is Escalate or Investigate. */
    EMERGING_THREATS,
    /** Response decision is Escalate or Investigate. */
    INVESTIGATE_FURTHER
}
