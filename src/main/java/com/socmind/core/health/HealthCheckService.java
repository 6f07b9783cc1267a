package com.socmind.core.health;

import com.socmind.core.engine.TaskRegistry;
import com.socmind.core.graph.TaskGraph;
import com.socmind.core.model.AgentId;
import com.socmind.core.model.TaskStatus;
import com.socmind.provider.ProviderRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final TaskGraph taskGraph;
    private final ProviderRegistry providerRegistry;
    private final TaskRegistry taskRegistry;

    public HealthCheckService(
            @Autowired(required = false) TaskGraph taskGraph,
            @Autowired(required = false) ProviderRegistry providerRegistry,
            @Autowired(required = false) TaskRegistry taskRegistry) {
        this.taskGraph = taskGraph;
        this.providerRegistry = providerRegistry;
        this.taskRegistry = taskRegistry;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkProviders());
        results.add(checkTasks());
        return results;
    }

    private HealthStatus checkGraph() {
        if (taskGraph != null) {
            return new HealthStatus("graph", HealthStatus.Status.UP,
                    "Graph compiled and available", Map.of());
        }
        return new HealthStatus("graph", HealthStatus.Status.DOWN,
                "Graph not available", Map.of());
    }

    /**
     * DOWN with no providers at all, DEGRADED when some agent has none.
     */
    private HealthStatus checkProviders() {
        if (providerRegistry == null || providerRegistry.registeredAgents().isEmpty()) {
            return new HealthStatus("providers", HealthStatus.Status.DOWN,
                    "No capability providers registered", Map.of());
        }
        var metadata = new LinkedHashMap<String, String>();
        providerRegistry.describe().forEach((id, impl) -> metadata.put(id.wireName(), impl));
        var missing = Arrays.stream(AgentId.values())
                .filter(id -> !providerRegistry.isRegistered(id))
                .map(AgentId::wireName)
                .toList();
        if (!missing.isEmpty()) {
            return new HealthStatus("providers", HealthStatus.Status.DEGRADED,
                    "No provider for " + String.join(", ", missing), metadata);
        }
        return new HealthStatus("providers", HealthStatus.Status.UP,
                "All agents have providers", metadata);
    }

    private HealthStatus checkTasks() {
        if (taskRegistry == null) {
            return new HealthStatus("engine", HealthStatus.Status.DOWN,
                    "Task registry not available", Map.of());
        }
        var metadata = new LinkedHashMap<String, String>();
        metadata.put("total", String.valueOf(taskRegistry.values().size()));
        for (var status : TaskStatus.values()) {
            long count = taskRegistry.count(status);
            if (count > 0) {
                metadata.put(status.name(), String.valueOf(count));
            }
        }
        return new HealthStatus("engine", HealthStatus.Status.UP,
                "Engine accepting tasks", metadata);
    }
}
