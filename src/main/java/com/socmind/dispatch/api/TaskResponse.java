package com.socmind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.socmind.core.engine.TaskRegistry;
import com.socmind.core.model.ActionRecord;
import com.socmind.core.model.EscalationEvent;
import com.socmind.core.model.PlanStep;
import com.socmind.core.state.TaskState;

import java.util.List;
import java.util.Set;

/**
 * JSON response for task endpoints.
 */
public record TaskResponse(
    @JsonProperty("task_id") String taskId,
    @JsonProperty("task_type") String taskType,
    String status,
    @JsonProperty("risk_tier") String riskTier,
    @JsonProperty("received_at") String receivedAt,
    List<StepResponse> steps,
    @JsonProperty("group_count") int groupCount,
    EscalationEvent escalation,
    List<String> errors,
    @JsonProperty("termination_reason") String terminationReason
) {

    /**
     * A plan step with the latest outcome recorded for it.
     */
    public record StepResponse(
        String id,
        String agent,
        String action,
        @JsonProperty("parallel_group") Integer parallelGroup,
        String status,
        int attempts
    ) {}

    static TaskResponse from(TaskRegistry.TrackedTask tracked) {
        var task = tracked.task();
        var state = tracked.state();
        return new TaskResponse(
                task.id(),
                task.taskType().wireName(),
                tracked.status().name(),
                state.flatMap(TaskState::riskTier).map(Enum::name).orElse(null),
                tracked.receivedAt().toString(),
                state.map(TaskResponse::steps).orElse(List.of()),
                state.map(TaskState::groupCount).orElse(0),
                state.flatMap(TaskState::escalation).orElse(null),
                state.map(TaskState::errors).orElse(List.of()),
                state.map(TaskState::terminationReason).filter(r -> !r.isBlank()).orElse(null));
    }

    private static List<StepResponse> steps(TaskState state) {
        var completed = state.completedStepIds();
        var context = state.context();
        return state.plan().map(plan -> plan.steps().stream()
                .map(step -> toStep(step, completed, context.previousActions()))
                .toList())
                .orElse(List.of());
    }

    private static StepResponse toStep(PlanStep step, Set<String> completed, List<ActionRecord> actions) {
        var records = actions.stream().filter(a -> a.stepId().equals(step.id())).toList();
        String status;
        if (completed.contains(step.id())) {
            status = "COMPLETED";
        } else if (records.isEmpty()) {
            status = "PENDING";
        } else {
            status = records.get(records.size() - 1).succeeded() ? "PARTIAL" : "FAILED";
        }
        int attempts = records.stream().mapToInt(ActionRecord::attempt).max().orElse(0);
        return new StepResponse(step.id(), step.agentId().wireName(), step.action(),
                step.parallelGroup(), status, attempts);
    }
}
