package com.socmind.provider;

import com.socmind.core.model.AgentId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Capability providers keyed by the agent id they serve. Built by {@link ProviderConfig}.
 */
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<AgentId, CapabilityProvider> providers = new EnumMap<>(AgentId.class);

    public ProviderRegistry(List<CapabilityProvider> providers) {
        for (var provider : providers) {
            var previous = this.providers.put(provider.agentId(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider for agent " + provider.agentId().wireName()
                        + ": " + previous.getClass().getSimpleName() + " and " + provider.getClass().getSimpleName());
            }
        }
        log.info("Registered capability providers: {}", this.providers.keySet());
    }

    /**
     * @throws ProviderNotRegisteredException if no provider serves {@code agentId}
     */
    public CapabilityProvider get(AgentId agentId) {
        var provider = providers.get(agentId);
        if (provider == null) {
            throw new ProviderNotRegisteredException("No capability provider registered for " + agentId.wireName());
        }
        return provider;
    }

    public boolean isRegistered(AgentId agentId) {
        return providers.containsKey(agentId);
    }

    public Set<AgentId> registeredAgents() {
        return Set.copyOf(providers.keySet());
    }

    public Map<AgentId, String> describe() {
        var description = new EnumMap<AgentId, String>(AgentId.class);
        providers.forEach((id, p) -> description.put(id, p.getClass().getSimpleName()));
        return description;
    }
}
