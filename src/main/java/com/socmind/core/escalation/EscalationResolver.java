package com.socmind.core.escalation;

import com.socmind.core.graph.GraphProperties;
import com.socmind.core.model.DecisionPoint;
import com.socmind.core.model.EscalationReason;
import com.socmind.core.model.HumanDecision;
import com.socmind.core.model.Plan;
import com.socmind.core.model.PlanStep;
import com.socmind.core.model.TaskStatus;
import com.socmind.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies a reviewer's decision to a halted task and returns the state to resume from.
 * <ul>
 *   <li>Proceed acknowledges the trigger so it does not fire again for the same cause.
 *       Proceeding past an unevaluable decision point must supply its outcome.</li>
 *   <li>Abort marks the task Aborted; the resumed run only synthesizes the audit.</li>
 *   <li>Modify-plan replaces every step that has not completed. It is refused while an
 *       alert is still waiting for triage, since triage picks the plan.</li>
 * </ul>
 */
@Service
public class EscalationResolver {

    private static final Logger log = LoggerFactory.getLogger(EscalationResolver.class);

    private final GraphProperties graphProperties;

    public EscalationResolver(GraphProperties graphProperties) {
        this.graphProperties = graphProperties;
    }

    /**
     * @throws IllegalStateException    if the task is not halted on an escalation
     * @throws IllegalArgumentException if the decision is incomplete or its replacement plan is invalid
     */
    public Map<String, Object> apply(TaskState state, HumanDecision decision) {
        if (!state.status().isHalted()) {
            throw new IllegalStateException("Task %s is %s, not awaiting a decision"
                    .formatted(state.taskId(), state.status()));
        }
        var escalation = state.escalation()
                .orElseThrow(() -> new IllegalStateException("Task " + state.taskId() + " has no pending escalation"));

        var data = new HashMap<String, Object>(state.data());
        data.remove(TaskState.ESCALATION);
        var decisions = new ArrayList<>(state.humanDecisions());
        decisions.add(decision);
        data.put(TaskState.HUMAN_DECISIONS, decisions);

        var acknowledged = state.acknowledgedTriggers();
        switch (decision.type()) {
            case ABORT -> {
                data.put(TaskState.STATUS, TaskStatus.ABORTED.name());
                data.put(TaskState.TERMINATION_REASON, "Aborted by %s after %s%s".formatted(
                        decision.reviewer(), escalation.reason(),
                        decision.note() == null || decision.note().isBlank() ? "" : ": " + decision.note()));
            }
            case PROCEED -> {
                if (escalation.reason() == EscalationReason.UNEVALUABLE_DECISION) {
                    if (decision.conditionOutcome() == null) {
                        throw new IllegalArgumentException("Proceeding past decision point "
                                + escalation.triggeringStep() + " requires a condition outcome");
                    }
                    var plan = state.plan().orElseThrow();
                    data.put(TaskState.PLAN, plan.resolve(escalation.triggeringStep(), decision.conditionOutcome()));
                }
                acknowledged.add(escalation.triggerKey());
                data.put(TaskState.STATUS, resumeStatus(state).name());
            }
            case MODIFY_PLAN -> {
                if (state.task().requiresTriageFirst() && state.riskTier().isEmpty()) {
                    throw new IllegalArgumentException("Task " + state.taskId()
                            + " has no triage result yet; the plan is chosen by triage, so Proceed or Abort instead");
                }
                var completed = state.completedStepIds();
                validateReplacement(decision.replacementSteps(), decision.replacementDecisionPoints(), completed);
                var plan = state.plan()
                        .map(p -> p.replaceRemaining(completed, decision.replacementSteps(),
                                decision.replacementDecisionPoints(), decision.note()))
                        .orElseGet(() -> new Plan(decision.replacementSteps(), decision.replacementDecisionPoints(),
                                decision.note(), 1));
                data.put(TaskState.PLAN, plan);
                acknowledged.add(escalation.triggerKey());
                data.put(TaskState.STATUS, resumeStatus(state).name());
            }
        }
        data.put(TaskState.ACKNOWLEDGED_TRIGGERS, List.copyOf(acknowledged));
        log.info("Task {}: {} by {} resolves {} ({})", state.taskId(), decision.type(), decision.reviewer(),
                escalation.id(), escalation.reason());
        return data;
    }

    private TaskStatus resumeStatus(TaskState state) {
        return state.task().requiresTriageFirst() && state.riskTier().isEmpty() && state.plan().isEmpty()
                ? TaskStatus.TRIAGE_PENDING
                : TaskStatus.DISPATCHING;
    }

    private void validateReplacement(List<PlanStep> steps, List<DecisionPoint> points, Set<String> completed) {
        int max = graphProperties.getMaxPlanSteps();
        if (steps.size() > max || points.size() > max) {
            throw new IllegalArgumentException("Replacement plan exceeds %d steps or decision points".formatted(max));
        }
        var ids = new HashSet<String>();
        for (var step : steps) {
            if (step.id() == null || step.id().isBlank() || step.agentId() == null) {
                throw new IllegalArgumentException("Replacement steps need an id and an agent");
            }
            if (!ids.add(step.id()) || completed.contains(step.id())) {
                throw new IllegalArgumentException("Duplicate step id in replacement plan: " + step.id());
            }
        }
        for (var dp : points) {
            if (!ids.contains(dp.afterStepId()) && !completed.contains(dp.afterStepId())) {
                throw new IllegalArgumentException("Decision point %s follows unknown step %s"
                        .formatted(dp.id(), dp.afterStepId()));
            }
            for (var guarded : dp.trueBranch()) {
                requireKnown(dp, guarded, ids);
            }
            for (var guarded : dp.falseBranch()) {
                requireKnown(dp, guarded, ids);
            }
        }
    }

    private void requireKnown(DecisionPoint dp, String stepId, Set<String> ids) {
        if (!ids.contains(stepId)) {
            throw new IllegalArgumentException("Decision point %s names unknown step %s".formatted(dp.id(), stepId));
        }
    }
}
