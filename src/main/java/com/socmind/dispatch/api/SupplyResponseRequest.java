package com.socmind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.socmind.core.model.AgentDecision;
import com.socmind.core.model.AgentId;
import com.socmind.core.model.AgentResponse;
import com.socmind.core.model.Priority;

import java.util.List;
import java.util.Set;

/**
 * Inbound JSON body for POST /api/v1/tasks/{id}/steps/{stepId}/response. Same shape as
 * the payload an HTTP capability provider returns.
 */
public record SupplyResponseRequest(
    @JsonProperty("agent_id") String agentId,
    String findings,
    @JsonProperty("risk_score") Integer riskScore,
    String priority,
    String decision,
    @JsonProperty("correlated_alert_ids") List<String> correlatedAlertIds
) {

    public AgentResponse toResponse() {
        return new AgentResponse(
                AgentId.fromWire(agentId),
                findings,
                riskScore,
                priority == null ? null : Priority.fromWire(priority),
                decision == null ? null : AgentDecision.fromWire(decision),
                correlatedAlertIds == null ? Set.of() : Set.copyOf(correlatedAlertIds));
    }
}
