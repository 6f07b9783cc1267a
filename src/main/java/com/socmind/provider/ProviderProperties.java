package com.socmind.provider;

import com.socmind.core.model.AgentId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "socmind.providers")
public class ProviderProperties {

    /** "simulated" or "http". */
    private String mode = "simulated";
    /** Per-attempt timeout; also the limit on a step's total wait across its retry. */
    private int timeoutSeconds = 30;
    /** Per-agent timeout overrides keyed by agent wire name. */
    private Map<String, Integer> agentTimeouts = new HashMap<>();
    private long retryBackoffMs = 500;
    private int maxParallel = 4;
    private int connectTimeoutSeconds = 5;
    /** HTTP endpoints keyed by agent wire name. */
    private Map<String, String> endpoints = new HashMap<>();

    public long timeoutMillisFor(AgentId agentId) {
        return agentTimeouts.getOrDefault(agentId.wireName(), timeoutSeconds) * 1000L;
    }

    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public Map<String, Integer> getAgentTimeouts() { return agentTimeouts; }
    public void setAgentTimeouts(Map<String, Integer> agentTimeouts) { this.agentTimeouts = agentTimeouts; }
    public long getRetryBackoffMs() { return retryBackoffMs; }
    public void setRetryBackoffMs(long retryBackoffMs) { this.retryBackoffMs = retryBackoffMs; }
    public int getMaxParallel() { return maxParallel; }
    public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
    public Map<String, String> getEndpoints() { return endpoints; }
    public void setEndpoints(Map<String, String> endpoints) { this.endpoints = endpoints; }
}
