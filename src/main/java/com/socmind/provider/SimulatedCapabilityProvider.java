package com.socmind.provider;

import com.socmind.core.model.AgentDecision;
import com.socmind.core.model.AgentId;
import com.socmind.core.model.AgentResponse;
import com.socmind.core.model.Alert;
import com.socmind.core.model.Priority;
import com.socmind.core.model.Severity;
import com.socmind.core.model.TaskContext;
import com.socmind.core.model.TaskType;

import java.util.Set;

/**
 * Deterministic stand-in for the real agents, used for demos and local runs.
 * Responses are derived from the alert severity and the task type only, so the same
 * task always takes the same path through its plan.
 */
public class SimulatedCapabilityProvider implements CapabilityProvider {

    private final AgentId agentId;

    public SimulatedCapabilityProvider(AgentId agentId) {
        this.agentId = agentId;
    }

    @Override
    public AgentId agentId() {
        return agentId;
    }

    @Override
    public AgentResponse invoke(AgentId requested, TaskSnapshot snapshot, TaskContext context) {
        var task = snapshot.task();
        var severity = task.alert() != null && task.alert().severity() != null
                ? task.alert().severity()
                : Severity.MEDIUM;
        return switch (requested) {
            case TRIAGE -> triage(task.alert(), severity);
            case HUNTING -> hunting(task.taskType(), task.alert(), severity);
            case RESPONSE -> new AgentResponse(AgentId.RESPONSE,
                    "Containment applied: isolated " + describeEntities(task.alert()),
                    null, null,
                    severity == Severity.CRITICAL ? AgentDecision.INVESTIGATE : AgentDecision.MONITOR,
                    Set.of());
            case INTEL -> intel(task.taskType(), severity);
        };
    }

    private AgentResponse triage(Alert alert, Severity severity) {
        int score = switch (severity) {
            case CRITICAL -> 95;
            case HIGH -> 85;
            case MEDIUM -> 65;
            case LOW -> 30;
            case INFORMATIONAL -> 10;
        };
        var priority = switch (severity) {
            case CRITICAL -> Priority.P1;
            case HIGH -> Priority.P2;
            case MEDIUM -> Priority.P3;
            case LOW -> Priority.P4;
            case INFORMATIONAL -> Priority.P5;
        };
        var decision = switch (severity) {
            case CRITICAL, HIGH -> AgentDecision.ESCALATE;
            case MEDIUM -> AgentDecision.INVESTIGATE;
            case LOW -> AgentDecision.MONITOR;
            case INFORMATIONAL -> AgentDecision.DISMISS;
        };
        String name = alert != null ? alert.name() : "findings";
        return new AgentResponse(AgentId.TRIAGE,
                "Triage of '%s': severity %s, risk score %d".formatted(name, severity, score),
                score, priority, decision, Set.of());
    }

    private AgentResponse hunting(TaskType taskType, Alert alert, Severity severity) {
        if (taskType == TaskType.THREAT_HUNT) {
            // Proactive hunts in the demo environment come back clean.
            return new AgentResponse(AgentId.HUNTING, "", null, null, AgentDecision.MONITOR, Set.of());
        }
        var correlated = alert != null ? Set.of(alert.alertId() + "-related") : Set.<String>of();
        return new AgentResponse(AgentId.HUNTING,
                "Found related activity on " + describeEntities(alert),
                null, null, AgentDecision.INVESTIGATE, correlated);
    }

    private AgentResponse intel(TaskType taskType, Severity severity) {
        if (taskType == TaskType.THREAT_BRIEF) {
            return new AgentResponse(AgentId.INTEL,
                    "Daily brief: credential-phishing campaign targeting the finance sector",
                    null, null, AgentDecision.INVESTIGATE, Set.of());
        }
        return new AgentResponse(AgentId.INTEL,
                "Indicators match commodity tooling; no APT attribution",
                null, null, AgentDecision.MONITOR, Set.of());
    }

    private static String describeEntities(Alert alert) {
        if (alert == null || alert.entities().isEmpty()) {
            return "no named entities";
        }
        return String.join(", ", alert.entities().stream().map(e -> e.name()).toList());
    }
}
