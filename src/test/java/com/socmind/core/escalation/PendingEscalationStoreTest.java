package com.socmind.core.escalation;

import com.socmind.core.events.EventBus;
import com.socmind.core.events.SocmindEvent;
import com.socmind.core.model.EscalationEvent;
import com.socmind.core.model.EscalationReason;
import com.socmind.core.model.HumanDecision;
import com.socmind.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PendingEscalationStoreTest {

    private EventBus eventBus;
    private PendingEscalationStore store;
    private List<SocmindEvent> published;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        store = new PendingEscalationStore(eventBus);
        published = new ArrayList<>();
        eventBus.subscribeAll(published::add);
    }

    @Test
    @DisplayName("raise keeps the escalation pending and publishes it")
    void raise() {
        var event = event("T-1", Instant.now());
        store.raise(event);

        assertEquals(event, store.pendingFor("T-1").orElseThrow());
        assertEquals(1, published.size());
        assertEquals("escalation.raised", published.get(0).eventType());
        assertEquals("CRITICAL_CONTAINMENT", published.get(0).payload().get("reason"));
    }

    @Test
    @DisplayName("resolved clears the escalation and publishes the resolution")
    void resolved() {
        store.raise(event("T-1", Instant.now()));
        store.resolved("T-1", HumanDecision.proceed("ana", null));

        assertTrue(store.pendingFor("T-1").isEmpty());
        assertEquals("escalation.resolved", published.get(1).eventType());
        assertEquals("PROCEED", published.get(1).payload().get("resolution"));
    }

    @Test
    @DisplayName("Supplied information resolves without a decision")
    void resolvedByInformation() {
        store.raise(event("T-1", Instant.now()));
        store.resolved("T-1", null);
        assertEquals("INFORMATION_SUPPLIED", published.get(1).payload().get("resolution"));
    }

    @Test
    @DisplayName("pending lists the oldest first")
    void pendingOrder() {
        var now = Instant.now();
        store.raise(event("T-2", now));
        store.raise(event("T-1", now.minusSeconds(60)));
        assertEquals(List.of("T-1", "T-2"), store.pending().stream().map(EscalationEvent::taskId).toList());
    }

    private static EscalationEvent event(String taskId, Instant at) {
        return new EscalationEvent("ESC-" + taskId, taskId, EscalationReason.CRITICAL_CONTAINMENT, "S1",
                Severity.CRITICAL, "DC containment", at);
    }
}
