package com.socmind.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.socmind.core.model.AgentId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the provider registry for the configured {@code socmind.providers.mode}.
 */
@Configuration
public class ProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(ProviderConfig.class);

    @Bean
    @ConditionalOnProperty(name = "socmind.providers.mode", havingValue = "simulated", matchIfMissing = true)
    public ProviderRegistry simulatedProviderRegistry() {
        var providers = new ArrayList<CapabilityProvider>();
        for (var agentId : AgentId.values()) {
            providers.add(new SimulatedCapabilityProvider(agentId));
        }
        return new ProviderRegistry(providers);
    }

    /**
     * One HTTP provider per configured endpoint. An agent without an endpoint is left
     * unregistered; tasks whose plans need it are aborted.
     */
    @Bean
    @ConditionalOnProperty(name = "socmind.providers.mode", havingValue = "http")
    public ProviderRegistry httpProviderRegistry(ProviderProperties properties, ObjectMapper objectMapper) {
        List<CapabilityProvider> providers = new ArrayList<>();
        properties.getEndpoints().forEach((agent, url) -> {
            var agentId = AgentId.fromWire(agent);
            providers.add(new HttpCapabilityProvider(agentId, URI.create(url), objectMapper,
                    Duration.ofSeconds(properties.getConnectTimeoutSeconds()),
                    Duration.ofMillis(properties.timeoutMillisFor(agentId))));
            log.info("HTTP provider for {} at {}", agentId.wireName(), url);
        });
        return new ProviderRegistry(providers);
    }
}
