package com.socmind.core.model;

import java.io.Serializable;

/**
 * A unit of security work accepted by the engine. Immutable once accepted.
 *
 * @param id          engine-assigned identifier (e.g. "SOC-2026-0001")
 * @param taskType    kind of work
 * @param description analyst-facing description
 * @param alert       the alert under analysis; required for {@link TaskType#ALERT_ANALYSIS}
 * @param context     initial context supplied with the task (related incidents)
 */
public record Task(
    String id,
    TaskType taskType,
    String description,
    Alert alert,
    TaskContext context
) implements Serializable {

    public Task {
        context = context == null ? TaskContext.empty() : context;
    }

    public boolean requiresTriageFirst() {
        return taskType == TaskType.ALERT_ANALYSIS;
    }
}
