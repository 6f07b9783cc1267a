package com.socmind.core.nodes;

import com.socmind.core.events.EventBus;
import com.socmind.core.events.SocmindEvent;
import com.socmind.core.model.PlanStep;
import com.socmind.core.model.TaskStatus;
import com.socmind.core.planning.PlanBuilder;
import com.socmind.core.state.TaskState;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds the plan for the task from its type and, for alert work, its triage risk tier.
 */
@Component
public class BuildPlanNode {

    private final PlanBuilder planBuilder;
    private final EventBus eventBus;

    public BuildPlanNode(PlanBuilder planBuilder, EventBus eventBus) {
        this.planBuilder = planBuilder;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(TaskState state) {
        var task = state.task();
        eventBus.publish(SocmindEvent.status(task.id(), TaskStatus.PLANNING));

        var plan = planBuilder.build(task.taskType(), state.riskTier().orElse(null));

        eventBus.publish(SocmindEvent.of("plan.built", task.id(), null,
                Map.of("steps", plan.steps().stream().map(PlanStep::id).toList(),
                       "decisionPoints", plan.decisionPoints().size(),
                       "note", plan.note())));
        return Map.of(
                TaskState.PLAN, plan,
                TaskState.STATUS, TaskStatus.PLANNING.name()
        );
    }
}
