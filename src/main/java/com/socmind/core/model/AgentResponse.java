package com.socmind.core.model;

import java.io.Serializable;
import java.util.Set;

/**
 * Structured output of a capability provider. The only channel through which a
 * provider influences control flow.
 *
 * @param agentId            provider that produced the response
 * @param findings           free-text findings; null when the provider reported none at all
 * @param riskScore          0..100; nullable
 * @param priority           nullable
 * @param decision           recommendation; nullable
 * @param correlatedAlertIds related alert ids found by the provider
 */
public record AgentResponse(
    AgentId agentId,
    String findings,
    Integer riskScore,
    Priority priority,
    AgentDecision decision,
    Set<String> correlatedAlertIds
) implements Serializable {

    public AgentResponse {
        correlatedAlertIds = correlatedAlertIds == null ? Set.of() : Set.copyOf(correlatedAlertIds);
    }

    public boolean hasFindings() {
        return findings != null && !findings.isBlank();
    }
}
