package com.socmind.core.nodes;

import com.socmind.core.escalation.EscalationGate;
import com.socmind.core.events.EventBus;
import com.socmind.core.events.SocmindEvent;
import com.socmind.core.model.DecisionPoint;
import com.socmind.core.model.Plan;
import com.socmind.core.model.PlanStep;
import com.socmind.core.model.TaskStatus;
import com.socmind.core.planning.DecisionEvaluator;
import com.socmind.core.scheduler.GroupScheduler;
import com.socmind.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides what the task does next.
 * <p>
 * Every decision point whose producing step has completed is evaluated first and the plan
 * narrowed. A decision point that cannot be evaluated gets one re-dispatch of its producing
 * step; if it is still unevaluable the task halts in AwaitingInformation. Otherwise the next
 * group is selected and passed through the escalation gate before dispatch.
 */
@Component
public class ScheduleGroupNode {

    private static final Logger log = LoggerFactory.getLogger(ScheduleGroupNode.class);

    private final GroupScheduler scheduler;
    private final DecisionEvaluator evaluator;
    private final EscalationGate gate;
    private final EventBus eventBus;

    public ScheduleGroupNode(GroupScheduler scheduler, DecisionEvaluator evaluator,
                             EscalationGate gate, EventBus eventBus) {
        this.scheduler = scheduler;
        this.evaluator = evaluator;
        this.gate = gate;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(TaskState state) {
        var task = state.task();
        var plan = state.plan().orElseThrow(() -> new IllegalStateException("Task " + task.id() + " has no plan"));
        var completed = state.completedStepIds();
        var retried = state.retriedStepIds();
        var context = state.context();
        var updates = new HashMap<String, Object>();

        Optional<DecisionPoint> unevaluable = Optional.empty();
        boolean narrowed = true;
        while (narrowed) {
            narrowed = false;
            for (var dp : scheduler.readyDecisionPoints(plan, completed)) {
                var outcome = evaluator.evaluate(dp, context);
                if (outcome.isPresent()) {
                    plan = plan.resolve(dp.id(), outcome.get());
                    log.info("Decision point {} ({}) after {} evaluated {}", dp.id(), dp.condition(),
                            dp.afterStepId(), outcome.get());
                    eventBus.publish(SocmindEvent.of("decision.evaluated", task.id(), dp.afterStepId(),
                            Map.of("decisionPoint", dp.id(),
                                   "condition", dp.condition().name(),
                                   "outcome", outcome.get())));
                    narrowed = true;
                    break;
                }
                unevaluable = Optional.of(dp);
                break;
            }
            if (unevaluable.isPresent()) {
                break;
            }
        }
        updates.put(TaskState.PLAN, plan);

        if (unevaluable.isPresent()) {
            var dp = unevaluable.get();
            var producer = dp.afterStepId();
            if (!retried.contains(producer) && plan.step(producer).isPresent()) {
                log.warn("Decision point {} cannot be evaluated; re-dispatching {} once", dp.id(), producer);
                completed.remove(producer);
                retried.add(producer);
                updates.put(TaskState.COMPLETED_STEP_IDS, List.copyOf(completed));
                updates.put(TaskState.RETRIED_STEP_IDS, List.copyOf(retried));
                return dispatch(state, updates, List.of(plan.step(producer).get()));
            }
            log.warn("Decision point {} still cannot be evaluated; awaiting information", dp.id());
            return Halts.halt(state, updates, gate.unevaluable(task, dp), TaskStatus.AWAITING_INFORMATION, eventBus);
        }

        var group = scheduler.computeNextGroup(plan, completed);
        if (group.isEmpty()) {
            var remaining = scheduler.remaining(plan, completed);
            if (remaining.isEmpty()) {
                log.info("Task {} has no steps left", task.id());
                eventBus.publish(SocmindEvent.status(task.id(), TaskStatus.SYNTHESIZING));
                updates.put(TaskState.STATUS, TaskStatus.SYNTHESIZING.name());
                updates.put(TaskState.GROUP_STEP_IDS, List.of());
                return updates;
            }
            var blocking = blockingDecisionPoint(plan, remaining.get(0), completed);
            log.warn("Task {} is blocked at {} by decision point {}", task.id(), remaining.get(0).id(), blocking.id());
            return Halts.halt(state, updates, gate.unevaluable(task, blocking), TaskStatus.AWAITING_INFORMATION, eventBus);
        }

        var escalation = gate.beforeDispatch(task, group, state.acknowledgedTriggers());
        if (escalation.isPresent()) {
            log.warn("Dispatch of {} held for review", group.stream().map(PlanStep::id).toList());
            return Halts.halt(state, updates, escalation.get(), TaskStatus.ESCALATED, eventBus);
        }
        return dispatch(state, updates, group);
    }

    private Map<String, Object> dispatch(TaskState state, Map<String, Object> updates, List<PlanStep> group) {
        var ids = new ArrayList<String>();
        group.forEach(s -> ids.add(s.id()));
        int groupNumber = state.groupCount() + 1;
        log.info("Task {} group {}: {}", state.taskId(), groupNumber, ids);
        eventBus.publish(SocmindEvent.status(state.taskId(), TaskStatus.DISPATCHING));
        updates.put(TaskState.GROUP_STEP_IDS, ids);
        updates.put(TaskState.GROUP_COUNT, groupNumber);
        updates.put(TaskState.STATUS, TaskStatus.DISPATCHING.name());
        return updates;
    }

    /** The open decision point guarding {@code step} whose producer can no longer complete. */
    private DecisionPoint blockingDecisionPoint(Plan plan, PlanStep step, Set<String> completed) {
        return plan.decisionPoints().stream()
                .filter(dp -> dp.guards(step.id()))
                .filter(dp -> !completed.contains(dp.afterStepId()))
                .findFirst()
                .orElseGet(() -> plan.decisionPoints().stream()
                        .filter(dp -> dp.guards(step.id()))
                        .findFirst()
                        .orElseThrow());
    }
}
