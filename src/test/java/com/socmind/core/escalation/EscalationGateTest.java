package com.socmind.core.escalation;

import com.socmind.core.model.ActionRecord;
import com.socmind.core.model.AgentDecision;
import com.socmind.core.model.AgentId;
import com.socmind.core.model.AgentResponse;
import com.socmind.core.model.Alert;
import com.socmind.core.model.Condition;
import com.socmind.core.model.DecisionPoint;
import com.socmind.core.model.Entity;
import com.socmind.core.model.EscalationReason;
import com.socmind.core.model.PlanStep;
import com.socmind.core.model.ProviderFailure;
import com.socmind.core.model.Severity;
import com.socmind.core.model.StepOutcome;
import com.socmind.core.model.Task;
import com.socmind.core.model.TaskContext;
import com.socmind.core.model.TaskType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EscalationGateTest {

    private final EscalationGate gate = new EscalationGate(new EscalationProperties());

    private static final PlanStep CONTAIN = new PlanStep("S1", AgentId.RESPONSE, PlanStep.CONTAIN, "", 1);
    private static final PlanStep ENRICH = new PlanStep("S2", AgentId.INTEL, "enrich", "", 1);

    // ===================================================================
    // Before dispatch
    // ===================================================================

    @Nested
    @DisplayName("beforeDispatch")
    class BeforeDispatch {

        @Test
        @DisplayName("Containment on a domain controller escalates as critical")
        void criticalContainment() {
            var event = gate.beforeDispatch(task(new Entity("Host", "DC-01", "Domain-Controller")),
                    List.of(CONTAIN, ENRICH), Set.of()).orElseThrow();
            assertEquals(EscalationReason.CRITICAL_CONTAINMENT, event.reason());
            assertEquals("S1", event.triggeringStep());
            assertEquals(Severity.CRITICAL, event.severity());
            assertEquals("T-1", event.taskId());
            assertTrue(event.id().startsWith("ESC-"));
        }

        @Test
        @DisplayName("Containment on ordinary assets proceeds")
        void ordinaryContainment() {
            assertTrue(gate.beforeDispatch(task(new Entity("Host", "WS-12", "workstation")),
                    List.of(CONTAIN), Set.of()).isEmpty());
        }

        @Test
        @DisplayName("Non-containment steps never escalate on critical assets")
        void nonContainment() {
            assertTrue(gate.beforeDispatch(task(new Entity("Host", "DC-01", "domain-controller")),
                    List.of(ENRICH), Set.of()).isEmpty());
        }

        @Test
        @DisplayName("An acknowledged containment does not fire again")
        void acknowledged() {
            var task = task(new Entity("Host", "DC-01", "domain-controller"));
            var first = gate.beforeDispatch(task, List.of(CONTAIN), Set.of()).orElseThrow();
            assertTrue(gate.beforeDispatch(task, List.of(CONTAIN), Set.of(first.triggerKey())).isEmpty());
        }
    }

    // ===================================================================
    // After receipt
    // ===================================================================

    @Nested
    @DisplayName("afterReceipt")
    class AfterReceipt {

        @Test
        @DisplayName("A failed record escalates with its failure reason")
        void failure() {
            var failed = new ActionRecord("S2", AgentId.INTEL, "enrich", 2, StepOutcome.FAILED, true, null,
                    ProviderFailure.TIMEOUT, "no answer", 1, 10L, false, Instant.now());
            var event = gate.afterReceipt(task(), List.of(failed), TaskContext.empty(), Set.of()).orElseThrow();
            assertEquals(EscalationReason.PROVIDER_TIMEOUT, event.reason());
            assertEquals("S2", event.triggeringStep());
        }

        @Test
        @DisplayName("Failures fire even when the same trigger was acknowledged")
        void failureIgnoresAcknowledgement() {
            var failed = new ActionRecord("S2", AgentId.INTEL, "enrich", 2, StepOutcome.FAILED, false, null,
                    ProviderFailure.MALFORMED_RESPONSE, "bad json", null, 1L, false, Instant.now());
            var event = gate.afterReceipt(task(), List.of(failed), TaskContext.empty(),
                    Set.of("MALFORMED_RESPONSE:S2"));
            assertTrue(event.isPresent());
        }

        @Test
        @DisplayName("A step that waited past its provider's timeout escalates on that step")
        void aggregateWait() {
            var quick = success("S1", AgentId.RESPONSE, AgentDecision.MONITOR);
            var slow = success("S2", AgentId.HUNTING, AgentDecision.MONITOR).withWaitExceeded();
            var event = gate.afterReceipt(task(), List.of(quick, slow),
                    TaskContext.empty().append(quick).append(slow), Set.of()).orElseThrow();
            assertEquals(EscalationReason.AGGREGATE_WAIT_EXCEEDED, event.reason());
            assertEquals("S2", event.triggeringStep());
        }

        @Test
        @DisplayName("Records within their timeout raise no wait escalation")
        void waitWithinLimit() {
            var quick = success("S1", AgentId.RESPONSE, AgentDecision.MONITOR);
            assertTrue(gate.waitExceeded(task(), List.of(quick)).isEmpty());
        }

        @Test
        @DisplayName("Escalate and Dismiss anywhere in history conflict, once")
        void conflict() {
            var triage = success("triage", AgentId.TRIAGE, AgentDecision.ESCALATE);
            var intel = success("S2", AgentId.INTEL, AgentDecision.DISMISS);
            var ctx = TaskContext.empty().append(triage).append(intel);

            var event = gate.afterReceipt(task(), List.of(intel), ctx, Set.of()).orElseThrow();
            assertEquals(EscalationReason.DECISION_CONFLICT, event.reason());
            assertEquals("triage|S2", event.triggeringStep());

            assertTrue(gate.afterReceipt(task(), List.of(intel), ctx, Set.of(event.triggerKey())).isEmpty());
        }

        @Test
        @DisplayName("Agreeing decisions do not escalate")
        void noConflict() {
            var ctx = TaskContext.empty()
                    .append(success("triage", AgentId.TRIAGE, AgentDecision.ESCALATE))
                    .append(success("S1", AgentId.RESPONSE, AgentDecision.INVESTIGATE));
            assertTrue(gate.conflict(task(), ctx, Set.of()).isEmpty());
        }
    }

    @Test
    @DisplayName("Unevaluable decision points name the decision point and the field read")
    void unevaluable() {
        var dp = new DecisionPoint("D1", Condition.FINDINGS_PRESENT, "S1", List.of("S2"), List.of());
        var event = gate.unevaluable(task(), dp);
        assertEquals(EscalationReason.UNEVALUABLE_DECISION, event.reason());
        assertEquals("D1", event.triggeringStep());
        assertTrue(event.detail().contains("findings"));
    }

    @Test
    @DisplayName("Critical categories are configurable")
    void configurableCategories() {
        var properties = new EscalationProperties();
        properties.setCriticalCategories(Set.of("payment-gateway"));
        var custom = new EscalationGate(properties);
        assertTrue(custom.beforeDispatch(task(new Entity("Host", "PAY-01", "payment-gateway")),
                List.of(CONTAIN), Set.of()).isPresent());
        assertTrue(custom.beforeDispatch(task(new Entity("Host", "DC-01", "domain-controller")),
                List.of(CONTAIN), Set.of()).isEmpty());
    }

    private static Task task(Entity... entities) {
        var alert = new Alert("A-1", "Test alert", Severity.HIGH, "", Set.of(), Set.of(), List.of(entities));
        return new Task("T-1", TaskType.ALERT_ANALYSIS, "", alert, TaskContext.empty());
    }

    private static ActionRecord success(String stepId, AgentId agent, AgentDecision decision) {
        return new ActionRecord(stepId, agent, "act", 1, StepOutcome.SUCCEEDED, false,
                new AgentResponse(agent, "x", null, null, decision, null), null, null, null, 1L, false, Instant.now());
    }
}
