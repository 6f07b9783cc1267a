package com.socmind.provider;

import com.socmind.core.model.AgentId;
import com.socmind.core.model.AgentResponse;
import com.socmind.core.model.TaskContext;

/**
 * Uniform contract every capability provider ("agent") implements.
 * <p>
 * Providers receive an immutable snapshot of the task and a read-only view of its
 * context. They report failures by throwing a {@link ProviderException} subtype.
 */
public interface CapabilityProvider {

    /** The agent id this provider serves. */
    AgentId agentId();

    /**
     * @throws ProviderTimeoutException           if the provider gave up waiting on its backend
     * @throws ProviderUnavailableException       if the provider cannot be reached
     * @throws ProviderMalformedResponseException if the provider's output cannot be understood
     */
    AgentResponse invoke(AgentId agentId, TaskSnapshot snapshot, TaskContext context);
}
