package com.socmind.core.health;

import java.util.Map;

/**
 * Health of one engine component.
 *
 * @param component component name ("graph", "providers", "engine")
 * @param status    UP, DOWN or DEGRADED
 * @param detail    human-readable explanation
 * @param metadata  component-specific details, e.g. provider per agent or task counts
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
