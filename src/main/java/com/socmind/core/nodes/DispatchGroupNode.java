package com.socmind.core.nodes;

import com.socmind.core.context.ContextStore;
import com.socmind.core.escalation.EscalationGate;
import com.socmind.core.events.EventBus;
import com.socmind.core.events.SocmindEvent;
import com.socmind.core.model.ActionRecord;
import com.socmind.core.model.PlanStep;
import com.socmind.core.model.ProviderFailure;
import com.socmind.core.model.TaskStatus;
import com.socmind.core.state.TaskState;
import com.socmind.provider.ProviderDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches the scheduled group, waits for every member and commits the results as one
 * unit. Members are only marked completed when the whole group succeeded.
 */
@Component
public class DispatchGroupNode {

    private static final Logger log = LoggerFactory.getLogger(DispatchGroupNode.class);

    private final ProviderDispatcher dispatcher;
    private final ContextStore contextStore;
    private final EscalationGate gate;
    private final EventBus eventBus;

    public DispatchGroupNode(ProviderDispatcher dispatcher, ContextStore contextStore,
                             EscalationGate gate, EventBus eventBus) {
        this.dispatcher = dispatcher;
        this.contextStore = contextStore;
        this.gate = gate;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(TaskState state) {
        var task = state.task();
        var plan = state.plan().orElseThrow(() -> new IllegalStateException("Task " + task.id() + " has no plan"));
        List<PlanStep> steps = state.groupStepIds().stream()
                .map(id -> plan.step(id)
                        .orElseThrow(() -> new IllegalStateException("Scheduled step " + id + " is not in the plan")))
                .toList();

        eventBus.publish(SocmindEvent.status(task.id(), TaskStatus.STEP_AWAITING));
        var result = dispatcher.dispatchGroup(task, steps, state.context(), state.groupCount());
        var context = contextStore.commitGroup(state.context(), result.records());

        var updates = new HashMap<String, Object>();
        updates.put(TaskState.CONTEXT, context);

        var missing = result.records().stream()
                .filter(r -> r.failure() == ProviderFailure.NOT_REGISTERED)
                .findFirst();
        if (missing.isPresent()) {
            log.error("Task {} aborted: {}", task.id(), missing.get().error());
            updates.put(TaskState.STATUS, TaskStatus.ABORTED.name());
            updates.put(TaskState.TERMINATION_REASON, "Required provider missing: " + missing.get().error());
            updates.put(TaskState.ERRORS, List.of(String.valueOf(missing.get().error())));
            return updates;
        }

        if (result.allSucceeded()) {
            var completed = state.completedStepIds();
            steps.forEach(s -> completed.add(s.id()));
            updates.put(TaskState.COMPLETED_STEP_IDS, List.copyOf(completed));
        } else {
            updates.put(TaskState.ERRORS, result.failures().stream()
                    .map(r -> "Step %s [%s] %s: %s".formatted(r.stepId(), r.agentId().wireName(), r.failure(), r.error()))
                    .toList());
        }

        var escalation = gate.afterReceipt(task, result.records(), context,
                state.acknowledgedTriggers());
        if (escalation.isPresent()) {
            return Halts.halt(state, updates, escalation.get(), TaskStatus.ESCALATED, eventBus);
        }

        log.info("Group {} of task {} committed: {}", result.groupNumber(), task.id(),
                result.records().stream().map(ActionRecord::stepId).toList());
        updates.put(TaskState.STATUS, TaskStatus.DISPATCHING.name());
        return updates;
    }
}
