package com.socmind.core.nodes;

import com.socmind.core.events.EventBus;
import com.socmind.core.events.SocmindEvent;
import com.socmind.core.model.ActionRecord;
import com.socmind.core.model.AgentDecision;
import com.socmind.core.model.AuditRecord;
import com.socmind.core.model.TaskStatus;
import com.socmind.core.scheduler.GroupScheduler;
import com.socmind.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Terminal node. Aggregates findings, decisions and open risks into the task's audit
 * record and settles its final status: Done, Escalated-Resolved when a reviewer decided
 * at least once, or Aborted.
 */
@Component
public class SynthesizeNode {

    private static final Logger log = LoggerFactory.getLogger(SynthesizeNode.class);

    private final GroupScheduler scheduler;
    private final EventBus eventBus;

    public SynthesizeNode(GroupScheduler scheduler, EventBus eventBus) {
        this.scheduler = scheduler;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(TaskState state) {
        var task = state.task();
        boolean aborted = state.status() == TaskStatus.ABORTED;
        if (!aborted) {
            eventBus.publish(SocmindEvent.status(task.id(), TaskStatus.SYNTHESIZING));
        }
        var finalStatus = aborted ? TaskStatus.ABORTED
                : state.humanDecisions().isEmpty() ? TaskStatus.DONE
                : TaskStatus.ESCALATED_RESOLVED;

        var context = state.context();
        var committed = context.committedActions();

        var keyFindings = new ArrayList<String>();
        var decisions = new ArrayList<String>();
        for (var action : committed) {
            var response = action.response();
            if (response.hasFindings()) {
                keyFindings.add("%s (%s): %s".formatted(action.agentId().wireName(), action.stepId(), response.findings()));
            }
            if (response.decision() != null) {
                decisions.add("%s (%s) recommends %s".formatted(
                        action.agentId().wireName(), action.stepId(), response.decision()));
            }
        }
        state.humanDecisions().forEach(d -> decisions.add("%s by %s%s".formatted(d.type(), d.reviewer(),
                d.note() == null || d.note().isBlank() ? "" : ": " + d.note())));

        var openRisks = openRisks(state, committed, aborted);
        var finalDecision = aborted ? "ABORTED" : committed.stream()
                .map(a -> a.response().decision())
                .filter(d -> d != null)
                .min(Comparator.naturalOrder())
                .map(AgentDecision::name)
                .orElse(state.plan().map(p -> p.note()).filter(n -> !n.isBlank()).orElse("MONITOR"));

        var terminationReason = !state.terminationReason().isBlank() ? state.terminationReason()
                : state.plan().map(p -> p.isEmpty() && !p.note().isBlank()).orElse(false)
                        ? "No provider steps required: " + state.plan().get().note()
                        : "Plan completed";

        var audit = new AuditRecord(
                task.id(),
                task.taskType(),
                finalStatus,
                state.riskTier().orElse(null),
                context.previousActions(),
                keyFindings,
                decisions,
                openRisks,
                state.escalations(),
                state.humanDecisions(),
                finalDecision,
                terminationReason,
                Instant.now());

        log.info("Task {} finished {}: {} actions, final decision {}", task.id(), finalStatus,
                context.previousActions().size(), finalDecision);
        eventBus.publish(SocmindEvent.status(task.id(), finalStatus));
        eventBus.publish(SocmindEvent.of("task.completed", task.id(), null,
                Map.of("status", finalStatus.name(),
                       "actions", context.previousActions().size(),
                       "finalDecision", finalDecision)));

        return Map.of(
                TaskState.STATUS, finalStatus.name(),
                TaskState.TERMINATION_REASON, terminationReason,
                TaskState.AUDIT, audit
        );
    }

    private List<String> openRisks(TaskState state, List<ActionRecord> committed, boolean aborted) {
        var risks = new ArrayList<String>();
        var context = state.context();
        for (var action : context.previousActions()) {
            if (!action.succeeded() && !context.hasSucceeded(action.stepId())) {
                risks.add("%s (%s) never returned a usable response: %s".formatted(
                        action.agentId().wireName(), action.stepId(), action.failure()));
            }
        }
        if (aborted) {
            state.plan().ifPresent(plan -> scheduler.remaining(plan, state.completedStepIds())
                    .forEach(s -> risks.add("Step %s (%s %s) was not executed".formatted(
                            s.id(), s.agentId().wireName(), s.action()))));
        }
        committed.stream()
                .filter(a -> a.response().decision() == AgentDecision.ESCALATE
                        || a.response().decision() == AgentDecision.INVESTIGATE)
                .forEach(a -> risks.add("%s (%s) recommended %s".formatted(
                        a.agentId().wireName(), a.stepId(), a.response().decision())));
        return risks.stream().distinct().toList();
    }
}
