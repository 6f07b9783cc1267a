package com.socmind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task orchestration.
 */
@Service
public class SocmindMetrics {

    private final MeterRegistry registry;

    public SocmindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskResult(String taskType, String status) {
        Counter.builder("socmind.tasks.total")
                .tag("type", taskType)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordProviderCall(String agentId, long ms, boolean succeeded) {
        Timer.builder("socmind.provider.duration")
                .tag("agent", agentId)
                .tag("outcome", succeeded ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordProviderFailure(String agentId, String failure) {
        Counter.builder("socmind.provider.failures")
                .description("Provider invocations that failed after retries")
                .tag("agent", agentId)
                .tag("failure", failure)
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String reason) {
        Counter.builder("socmind.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records one dispatched group.
     *
     * @param stepCount number of steps dispatched together
     * @param partial   true if any member failed
     */
    public void recordGroupExecution(int stepCount, boolean partial) {
        Counter.builder("socmind.group.executions")
                .description("Parallel group dispatches")
                .tag("outcome", partial ? "partial" : "complete")
                .register(registry)
                .increment();

        DistributionSummary.builder("socmind.group.step_count")
                .description("Number of steps per dispatched group")
                .register(registry)
                .record(stepCount);
    }
}
