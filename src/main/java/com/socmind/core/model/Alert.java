package com.socmind.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Set;

/**
 * Read-only alert input attached to alert-analysis tasks.
 *
 * @param alertId     source system alert identifier
 * @param name        alert rule name
 * @param severity    reported severity
 * @param description free-text description
 * @param tactics     MITRE ATT&amp;CK tactics
 * @param techniques  MITRE ATT&amp;CK technique ids
 * @param entities    entities in the order the source reported them
 */
public record Alert(
    String alertId,
    String name,
    Severity severity,
    String description,
    Set<String> tactics,
    Set<String> techniques,
    List<Entity> entities
) implements Serializable {

    public Alert {
        tactics = tactics == null ? Set.of() : Set.copyOf(tactics);
        techniques = techniques == null ? Set.of() : Set.copyOf(techniques);
        entities = entities == null ? List.of() : List.copyOf(entities);
    }
}
