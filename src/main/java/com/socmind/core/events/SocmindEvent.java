package com.socmind.core.events;

import com.socmind.core.model.TaskStatus;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a task runs, used for SSE streaming and the CLI.
 *
 * @param eventType event type (e.g. "task.received", "step.started", "escalation.raised")
 * @param taskId    the task this event belongs to
 * @param stepId    the plan step it relates to (nullable for task-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record SocmindEvent(
    String eventType,
    String taskId,
    String stepId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String STATUS_CHANGED = "task.status";

    public static SocmindEvent status(String taskId, TaskStatus status) {
        return of(STATUS_CHANGED, taskId, null, Map.of("status", status.name()));
    }

    public static SocmindEvent of(String eventType, String taskId, String stepId, Map<String, Object> payload) {
        return new SocmindEvent(eventType, taskId, stepId, payload, Instant.now());
    }
}
