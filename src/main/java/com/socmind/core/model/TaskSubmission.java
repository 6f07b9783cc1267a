package com.socmind.core.model;

import java.util.Set;

/**
 * A task as submitted, before the engine validates it and assigns an id.
 */
public record TaskSubmission(
    TaskType taskType,
    String description,
    Alert alert,
    Set<String> relatedIncidents
) {

    public TaskSubmission {
        relatedIncidents = relatedIncidents == null ? Set.of() : Set.copyOf(relatedIncidents);
    }
}
