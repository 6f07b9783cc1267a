package com.socmind.core.nodes;

import com.socmind.core.context.ContextStore;
import com.socmind.core.escalation.EscalationGate;
import com.socmind.core.events.EventBus;
import com.socmind.core.events.SocmindEvent;
import com.socmind.core.model.AgentId;
import com.socmind.core.model.PlanStep;
import com.socmind.core.model.ProviderFailure;
import com.socmind.core.model.TaskStatus;
import com.socmind.core.risk.RiskClassifier;
import com.socmind.core.state.TaskState;
import com.socmind.provider.ProviderDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Invokes the triage provider ahead of everything else for alert work and classifies
 * its risk score. No plan exists until this node has produced a risk tier.
 */
@Component
public class DispatchTriageNode {

    private static final Logger log = LoggerFactory.getLogger(DispatchTriageNode.class);

    public static final String TRIAGE_STEP_ID = "triage";

    static final PlanStep TRIAGE_STEP = new PlanStep(TRIAGE_STEP_ID, AgentId.TRIAGE, "triage",
            "Alert work is triaged before any other provider sees it", null);

    private final ProviderDispatcher dispatcher;
    private final ContextStore contextStore;
    private final RiskClassifier riskClassifier;
    private final EscalationGate gate;
    private final EventBus eventBus;

    public DispatchTriageNode(ProviderDispatcher dispatcher, ContextStore contextStore,
                              RiskClassifier riskClassifier, EscalationGate gate, EventBus eventBus) {
        this.dispatcher = dispatcher;
        this.contextStore = contextStore;
        this.riskClassifier = riskClassifier;
        this.gate = gate;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(TaskState state) {
        var task = state.task();
        eventBus.publish(SocmindEvent.status(task.id(), TaskStatus.TRIAGE_PENDING));

        var record = dispatcher.dispatchStep(task, TRIAGE_STEP, state.context(), null);
        var context = contextStore.commitGroup(state.context(), List.of(record));

        var updates = new HashMap<String, Object>();
        updates.put(TaskState.CONTEXT, context);

        if (!record.succeeded()) {
            if (record.failure() == ProviderFailure.NOT_REGISTERED) {
                log.error("Task {} aborted: {}", task.id(), record.error());
                updates.put(TaskState.STATUS, TaskStatus.ABORTED.name());
                updates.put(TaskState.TERMINATION_REASON, "Required provider missing: " + record.error());
                updates.put(TaskState.ERRORS, List.of(String.valueOf(record.error())));
                return updates;
            }
            var escalation = gate.afterReceipt(task, List.of(record), context, state.acknowledgedTriggers())
                    .orElseThrow();
            return Halts.halt(state, updates, escalation, TaskStatus.ESCALATED, eventBus);
        }

        var score = record.response().riskScore();
        if (!riskClassifier.isValidScore(score)) {
            log.warn("Triage for task {} returned no usable risk score", task.id());
            return Halts.halt(state, updates, gate.missingRiskScore(task, TRIAGE_STEP_ID),
                    TaskStatus.ESCALATED, eventBus);
        }

        var tier = riskClassifier.classify(score);
        log.info("Task {} triaged: risk score {} -> tier {}", task.id(), score, tier);
        eventBus.publish(SocmindEvent.of("triage.classified", task.id(), TRIAGE_STEP_ID,
                Map.of("riskScore", score, "riskTier", tier.name())));
        updates.put(TaskState.RISK_TIER, tier.name());
        // The tier stands; a reviewer only decides whether to go on after the slow answer.
        var slow = gate.waitExceeded(task, List.of(record));
        if (slow.isPresent()) {
            return Halts.halt(state, updates, slow.get(), TaskStatus.ESCALATED, eventBus);
        }
        eventBus.publish(SocmindEvent.status(task.id(), TaskStatus.TRIAGE_DONE));
        updates.put(TaskState.STATUS, TaskStatus.TRIAGE_DONE.name());
        return updates;
    }
}
