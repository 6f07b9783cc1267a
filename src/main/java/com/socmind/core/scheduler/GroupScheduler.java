package com.socmind.core.scheduler;

import com.socmind.core.model.DecisionPoint;
import com.socmind.core.model.Plan;
import com.socmind.core.model.PlanStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Picks what happens next in a plan: which decision points are ready to be evaluated
 * and which parallel group is dispatched next.
 * <p>
 * Steps run strictly in plan order. A step still guarded by an unresolved decision point
 * blocks every step after it, so no step is dispatched past an open branch.
 */
@Service
public class GroupScheduler {

    private static final Logger log = LoggerFactory.getLogger(GroupScheduler.class);

    /**
     * Decision points whose producing step has completed, in plan order.
     */
    public List<DecisionPoint> readyDecisionPoints(Plan plan, Set<String> completedStepIds) {
        return plan.decisionPoints().stream()
                .filter(dp -> completedStepIds.contains(dp.afterStepId()))
                .toList();
    }

    /**
     * Computes the next group to dispatch.
     *
     * @return the steps to dispatch together; empty if nothing remains or the next step is
     *         guarded by an unresolved decision point
     */
    public List<PlanStep> computeNextGroup(Plan plan, Set<String> completedStepIds) {
        var group = new ArrayList<PlanStep>();
        PlanStep lead = null;
        for (var step : plan.steps()) {
            if (completedStepIds.contains(step.id())) {
                continue;
            }
            if (plan.isGuarded(step.id())) {
                log.debug("  {} [{}] guarded by an open decision point", step.id(), step.agentId());
                if (lead == null) {
                    return List.of();
                }
                continue;
            }
            if (lead == null) {
                lead = step;
                group.add(step);
                if (step.parallelGroup() == null) {
                    break;
                }
            } else if (step.sharesGroupWith(lead)) {
                group.add(step);
            }
        }
        log.debug("computeNextGroup: {} completed {}, next {}",
                completedStepIds.size(), completedStepIds, group.stream().map(PlanStep::id).toList());
        return group;
    }

    /** Steps not yet completed. */
    public List<PlanStep> remaining(Plan plan, Set<String> completedStepIds) {
        return plan.steps().stream().filter(s -> !completedStepIds.contains(s.id())).toList();
    }
}
