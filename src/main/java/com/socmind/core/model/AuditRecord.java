package com.socmind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Immutable summary emitted once per task when it reaches a terminal state.
 */
public record AuditRecord(
    String taskId,
    TaskType taskType,
    TaskStatus finalStatus,
    RiskTier riskTier,
    List<ActionRecord> previousActions,
    List<String> keyFindings,
    List<String> decisions,
    List<String> openRisks,
    List<EscalationEvent> escalations,
    List<HumanDecision> humanDecisions,
    String finalDecision,
    String terminationReason,
    Instant completedAt
) implements Serializable {

    public AuditRecord {
        previousActions = List.copyOf(previousActions);
        keyFindings = List.copyOf(keyFindings);
        decisions = List.copyOf(decisions);
        openRisks = List.copyOf(openRisks);
        escalations = List.copyOf(escalations);
        humanDecisions = List.copyOf(humanDecisions);
    }
}
