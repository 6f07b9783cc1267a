package com.socmind.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Accumulated history of one task. Instances are immutable; every mutation returns a
 * new context whose {@code previousActions} starts with the previous list unchanged,
 * so recorded actions are never rewritten. Providers receive an instance as their
 * read-only view.
 *
 * @param previousActions    provider invocations in commit order
 * @param relatedIncidents   incident references supplied with the task
 * @param correlatedAlertIds alert ids providers reported as correlated
 */
public record TaskContext(
    List<ActionRecord> previousActions,
    Set<String> relatedIncidents,
    Set<String> correlatedAlertIds
) implements Serializable {

    public TaskContext {
        previousActions = previousActions == null ? List.of() : List.copyOf(previousActions);
        relatedIncidents = relatedIncidents == null ? Set.of() : Set.copyOf(relatedIncidents);
        correlatedAlertIds = correlatedAlertIds == null ? Set.of() : Set.copyOf(correlatedAlertIds);
    }

    public static TaskContext empty() {
        return new TaskContext(List.of(), Set.of(), Set.of());
    }

    public static TaskContext withRelatedIncidents(Set<String> relatedIncidents) {
        return new TaskContext(List.of(), relatedIncidents, Set.of());
    }

    /**
     * Returns a context with {@code records} appended as one unit. When any record failed
     * and the batch holds more than one record, every record in it is flagged as a
     * partial group so no member appears committed on its own.
     */
    public TaskContext appendAll(List<ActionRecord> records) {
        if (records.isEmpty()) {
            return this;
        }
        boolean partial = records.size() > 1 && records.stream().anyMatch(r -> !r.succeeded());
        var actions = new ArrayList<>(previousActions);
        var correlated = new LinkedHashSet<>(correlatedAlertIds);
        for (var record : records) {
            actions.add(partial ? record.asPartialGroup() : record);
            if (record.response() != null) {
                correlated.addAll(record.response().correlatedAlertIds());
            }
        }
        return new TaskContext(actions, relatedIncidents, correlated);
    }

    public TaskContext append(ActionRecord record) {
        return appendAll(List.of(record));
    }

    /** True if {@code response} is already recorded for {@code stepId}. */
    public boolean hasRecorded(String stepId, AgentResponse response) {
        return previousActions.stream()
                .anyMatch(r -> r.stepId().equals(stepId) && isCommitted(r) && r.response().equals(response));
    }

    public boolean hasSucceeded(String stepId) {
        return previousActions.stream().anyMatch(r -> r.stepId().equals(stepId) && isCommitted(r));
    }

    /** Successful responses outside partial groups, in commit order. */
    public List<ActionRecord> committedActions() {
        return previousActions.stream().filter(TaskContext::isCommitted).toList();
    }

    private static boolean isCommitted(ActionRecord record) {
        return record.succeeded() && !record.partialGroup() && record.response() != null;
    }

    public int attempts(String stepId) {
        return previousActions.stream()
                .filter(r -> r.stepId().equals(stepId))
                .mapToInt(ActionRecord::attempt)
                .max()
                .orElse(0);
    }

    /** Most recent successful response from {@code agentId}. */
    public Optional<AgentResponse> latestResponseFrom(AgentId agentId) {
        for (int i = previousActions.size() - 1; i >= 0; i--) {
            var record = previousActions.get(i);
            if (record.agentId() == agentId && isCommitted(record)) {
                return Optional.of(record.response());
            }
        }
        return Optional.empty();
    }

    /** Most recent successful response recorded for {@code stepId}. */
    public Optional<AgentResponse> latestResponseFor(String stepId) {
        for (int i = previousActions.size() - 1; i >= 0; i--) {
            var record = previousActions.get(i);
            if (record.stepId().equals(stepId) && isCommitted(record)) {
                return Optional.of(record.response());
            }
        }
        return Optional.empty();
    }
}
