package com.socmind.core.escalation;

import com.socmind.core.events.EventBus;
import com.socmind.core.events.SocmindEvent;
import com.socmind.core.metrics.SocmindMetrics;
import com.socmind.core.model.EscalationEvent;
import com.socmind.core.model.HumanDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Escalation sink that keeps the pending escalation of each task until it is resolved,
 * publishes it on the event bus and logs it at WARN.
 */
@Service
public class PendingEscalationStore implements EscalationSink {

    private static final Logger log = LoggerFactory.getLogger(PendingEscalationStore.class);

    private final ConcurrentHashMap<String, EscalationEvent> pending = new ConcurrentHashMap<>();
    private final EventBus eventBus;
    private final SocmindMetrics metrics;

    @Autowired
    public PendingEscalationStore(EventBus eventBus, SocmindMetrics metrics) {
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    PendingEscalationStore(EventBus eventBus) {
        this(eventBus, null);
    }

    @Override
    public void raise(EscalationEvent event) {
        pending.put(event.taskId(), event);
        log.warn("Escalation {} raised for task {}: {} at {} ({})", event.id(), event.taskId(),
                event.reason(), event.triggeringStep(), event.detail());
        if (metrics != null) {
            metrics.incrementEscalations(event.reason().name());
        }
        eventBus.publish(SocmindEvent.of("escalation.raised", event.taskId(), event.triggeringStep(),
                Map.of("escalationId", event.id(),
                       "reason", event.reason().name(),
                       "severity", event.severity().name(),
                       "detail", event.detail())));
    }

    public Optional<EscalationEvent> pendingFor(String taskId) {
        return Optional.ofNullable(pending.get(taskId));
    }

    public List<EscalationEvent> pending() {
        return pending.values().stream()
                .sorted(Comparator.comparing(EscalationEvent::raisedAt))
                .toList();
    }

    /** Clears the pending escalation of a task once a decision or the missing information is recorded. */
    @Override
    public void resolved(String taskId, HumanDecision decision) {
        var event = pending.remove(taskId);
        if (event == null) {
            return;
        }
        log.info("Escalation {} for task {} resolved: {}", event.id(), taskId,
                decision == null ? "information supplied" : decision.type() + " by " + decision.reviewer());
        eventBus.publish(SocmindEvent.of("escalation.resolved", taskId, event.triggeringStep(),
                Map.of("escalationId", event.id(),
                       "resolution", decision == null ? "INFORMATION_SUPPLIED" : decision.type().name())));
    }
}
