package com.socmind.core.escalation;

import com.socmind.core.model.ActionRecord;
import com.socmind.core.model.DecisionPoint;
import com.socmind.core.model.EscalationEvent;
import com.socmind.core.model.EscalationReason;
import com.socmind.core.model.PlanStep;
import com.socmind.core.model.Severity;
import com.socmind.core.model.Task;
import com.socmind.core.model.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Evaluates escalation triggers before a group is dispatched and after its results arrive.
 * <p>
 * Triggers that read recorded history (conflicting decisions, critical containment) are
 * suppressed once a reviewer acknowledged them with Proceed. Provider failures are
 * per-dispatch and always fire.
 */
@Service
public class EscalationGate {

    private static final Logger log = LoggerFactory.getLogger(EscalationGate.class);

    private final EscalationProperties properties;

    public EscalationGate(EscalationProperties properties) {
        this.properties = properties;
    }

    /**
     * Checks a group about to be dispatched. A containment step against an entity in a
     * critical category escalates unless already acknowledged.
     */
    public Optional<EscalationEvent> beforeDispatch(Task task, List<PlanStep> group, Set<String> acknowledged) {
        if (task.alert() == null) {
            return Optional.empty();
        }
        for (var step : group) {
            if (!step.isContainment()) {
                continue;
            }
            var critical = task.alert().entities().stream()
                    .filter(e -> properties.isCritical(e.category()))
                    .findFirst();
            if (critical.isEmpty()) {
                continue;
            }
            var event = newEvent(task, EscalationReason.CRITICAL_CONTAINMENT, step.id(), Severity.CRITICAL,
                    "Containment would act on %s '%s' (%s)".formatted(
                            critical.get().type(), critical.get().name(), critical.get().category()));
            if (acknowledged.contains(event.triggerKey())) {
                log.debug("Critical containment for step {} already approved", step.id());
                continue;
            }
            return Optional.of(event);
        }
        return Optional.empty();
    }

    /**
     * Checks a committed group. Failures take precedence, then a step whose total wait on
     * its provider passed that provider's timeout, then conflicting recommendations anywhere
     * in the committed history.
     */
    public Optional<EscalationEvent> afterReceipt(Task task, List<ActionRecord> records,
                                                  TaskContext context, Set<String> acknowledged) {
        for (var record : records) {
            if (!record.succeeded()) {
                var reason = EscalationReason.forFailure(record.failure());
                return Optional.of(newEvent(task, reason, record.stepId(), severityOf(task),
                        "%s failed after %d attempt(s): %s".formatted(
                                record.agentId().wireName(), record.attempt(), record.error())));
            }
        }
        var slow = waitExceeded(task, records);
        if (slow.isPresent()) {
            return slow;
        }
        return conflict(task, context, acknowledged);
    }

    /** The first record whose wait across retries passed its provider's timeout. */
    public Optional<EscalationEvent> waitExceeded(Task task, List<ActionRecord> records) {
        return records.stream()
                .filter(ActionRecord::waitExceeded)
                .findFirst()
                .map(r -> newEvent(task, EscalationReason.AGGREGATE_WAIT_EXCEEDED, r.stepId(), severityOf(task),
                        "%s took %d ms over %d attempt(s), longer than its timeout".formatted(
                                r.agentId().wireName(), r.elapsedMs(), r.attempt())));
    }

    /** Two committed responses whose decisions are Escalate and Dismiss. */
    public Optional<EscalationEvent> conflict(Task task, TaskContext context, Set<String> acknowledged) {
        var actions = context.committedActions();
        for (int i = 0; i < actions.size(); i++) {
            var first = actions.get(i);
            if (first.response().decision() == null) {
                continue;
            }
            for (int j = i + 1; j < actions.size(); j++) {
                var second = actions.get(j);
                if (second.response().decision() == null
                        || !first.response().decision().conflictsWith(second.response().decision())) {
                    continue;
                }
                var event = newEvent(task, EscalationReason.DECISION_CONFLICT,
                        first.stepId() + "|" + second.stepId(), severityOf(task),
                        "%s recommends %s but %s recommends %s".formatted(
                                first.agentId().wireName(), first.response().decision(),
                                second.agentId().wireName(), second.response().decision()));
                if (!acknowledged.contains(event.triggerKey())) {
                    return Optional.of(event);
                }
            }
        }
        return Optional.empty();
    }

    public EscalationEvent unevaluable(Task task, DecisionPoint decisionPoint) {
        return newEvent(task, EscalationReason.UNEVALUABLE_DECISION, decisionPoint.id(), severityOf(task),
                "Cannot evaluate %s: step %s recorded no usable %s".formatted(
                        decisionPoint.condition(), decisionPoint.afterStepId(), fieldRead(decisionPoint)));
    }

    public EscalationEvent missingRiskScore(Task task, String stepId) {
        return newEvent(task, EscalationReason.MISSING_RISK_SCORE, stepId, severityOf(task),
                "Triage returned no usable risk score; the plan cannot be chosen");
    }

    private static String fieldRead(DecisionPoint decisionPoint) {
        return switch (decisionPoint.condition()) {
            case APT_CONFIRMED, EMERGING_THREATS, INVESTIGATE_FURTHER -> "decision";
            case FINDINGS_PRESENT, THREATS_FOUND -> "findings";
            case HIGH_RISK -> "risk score";
        };
    }

    private static Severity severityOf(Task task) {
        return task.alert() != null && task.alert().severity() != null ? task.alert().severity() : Severity.HIGH;
    }

    private static EscalationEvent newEvent(Task task, EscalationReason reason, String triggeringStep,
                                            Severity severity, String detail) {
        return new EscalationEvent("ESC-" + UUID.randomUUID().toString().substring(0, 8), task.id(),
                reason, triggeringStep, severity, detail, Instant.now());
    }
}
