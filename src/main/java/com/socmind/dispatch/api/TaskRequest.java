package com.socmind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.socmind.core.model.Alert;
import com.socmind.core.model.Entity;
import com.socmind.core.model.InvalidTaskException;
import com.socmind.core.model.Severity;
import com.socmind.core.model.TaskSubmission;
import com.socmind.core.model.TaskType;

import java.util.List;
import java.util.Set;

/**
 * Inbound JSON body for POST /api/v1/tasks.
 *
 * @param taskType         alert_analysis, threat_hunt, incident_response or threat_brief
 * @param description      free-text description of the work
 * @param alert            the alert under analysis; required for alert_analysis
 * @param relatedIncidents incident ids already known to be related; nullable
 */
public record TaskRequest(
    @JsonProperty("task_type") String taskType,
    String description,
    AlertPayload alert,
    @JsonProperty("related_incidents") List<String> relatedIncidents
) {

    public record AlertPayload(
        @JsonProperty("alert_id") String alertId,
        String name,
        String severity,
        String description,
        List<String> tactics,
        List<String> techniques,
        List<EntityPayload> entities
    ) {}

    public record EntityPayload(
        String type,
        String name,
        String category
    ) {}

    /**
     * @throws InvalidTaskException if the task type or alert severity cannot be parsed
     */
    public TaskSubmission toSubmission() {
        TaskType type;
        try {
            type = TaskType.fromWire(taskType);
        } catch (IllegalArgumentException e) {
            throw new InvalidTaskException("Invalid task type: " + taskType);
        }
        return new TaskSubmission(type, description, toAlert(),
                relatedIncidents == null ? Set.of() : Set.copyOf(relatedIncidents));
    }

    private Alert toAlert() {
        if (alert == null) {
            return null;
        }
        Severity severity = null;
        if (alert.severity() != null) {
            try {
                severity = Severity.fromWire(alert.severity());
            } catch (IllegalArgumentException e) {
                throw new InvalidTaskException("Invalid alert severity: " + alert.severity());
            }
        }
        List<Entity> entities = alert.entities() == null ? List.of() : alert.entities().stream()
                .map(e -> new Entity(e.type(), e.name(), e.category()))
                .toList();
        return new Alert(alert.alertId(), alert.name(), severity, alert.description(),
                alert.tactics() == null ? Set.of() : Set.copyOf(alert.tactics()),
                alert.techniques() == null ? Set.of() : Set.copyOf(alert.techniques()),
                entities);
    }
}
