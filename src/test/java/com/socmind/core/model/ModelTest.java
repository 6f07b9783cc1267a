package com.socmind.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    // ===================================================================
    // Wire names
    // ===================================================================

    @Nested
    @DisplayName("Wire names")
    class WireNames {

        @Test
        @DisplayName("TaskType accepts wire names, enum names and hyphens")
        void taskTypeFromWire() {
            assertEquals(TaskType.ALERT_ANALYSIS, TaskType.fromWire("alert_analysis"));
            assertEquals(TaskType.THREAT_HUNT, TaskType.fromWire("THREAT_HUNT"));
            assertEquals(TaskType.INCIDENT_RESPONSE, TaskType.fromWire("incident-response"));
            assertEquals("threat_brief", TaskType.THREAT_BRIEF.wireName());
            assertThrows(IllegalArgumentException.class, () -> TaskType.fromWire("phishing"));
            assertThrows(IllegalArgumentException.class, () -> TaskType.fromWire(" "));
        }

        @Test
        @DisplayName("AgentId strips the -agent suffix")
        void agentIdFromWire() {
            assertEquals(AgentId.TRIAGE, AgentId.fromWire("triage-agent"));
            assertEquals(AgentId.INTEL, AgentId.fromWire("Intel"));
            assertThrows(IllegalArgumentException.class, () -> AgentId.fromWire("forensics"));
        }

        @Test
        @DisplayName("DecisionType parses modify-plan")
        void decisionTypeFromWire() {
            assertEquals(DecisionType.MODIFY_PLAN, DecisionType.fromWire("modify-plan"));
            assertEquals(DecisionType.ABORT, DecisionType.fromWire("Abort"));
        }

        @Test
        @DisplayName("Severity orders most severe first")
        void severityOrdering() {
            assertTrue(Severity.CRITICAL.isAtLeast(Severity.HIGH));
            assertTrue(Severity.HIGH.isAtLeast(Severity.HIGH));
            assertFalse(Severity.LOW.isAtLeast(Severity.MEDIUM));
            assertEquals(Severity.INFORMATIONAL, Severity.fromWire("informational"));
        }
    }

    // ===================================================================
    // Decisions and statuses
    // ===================================================================

    @Test
    @DisplayName("Only Escalate and Dismiss conflict")
    void conflictingDecisions() {
        assertTrue(AgentDecision.ESCALATE.conflictsWith(AgentDecision.DISMISS));
        assertTrue(AgentDecision.DISMISS.conflictsWith(AgentDecision.ESCALATE));
        assertFalse(AgentDecision.ESCALATE.conflictsWith(AgentDecision.MONITOR));
        assertFalse(AgentDecision.INVESTIGATE.conflictsWith(AgentDecision.DISMISS));
    }

    @Test
    @DisplayName("Provider failures map to escalation reasons")
    void escalationReasonForFailure() {
        assertEquals(EscalationReason.PROVIDER_TIMEOUT, EscalationReason.forFailure(ProviderFailure.TIMEOUT));
        assertEquals(EscalationReason.PROVIDER_UNAVAILABLE, EscalationReason.forFailure(ProviderFailure.UNAVAILABLE));
        assertEquals(EscalationReason.MALFORMED_RESPONSE,
                EscalationReason.forFailure(ProviderFailure.MALFORMED_RESPONSE));
        assertEquals(EscalationReason.PROVIDER_UNAVAILABLE,
                EscalationReason.forFailure(ProviderFailure.NOT_REGISTERED));
    }

    @Test
    @DisplayName("Terminal and halted statuses are disjoint")
    void statusClassification() {
        for (var status : TaskStatus.values()) {
            assertFalse(status.isTerminal() && status.isHalted(), status.name());
        }
        assertTrue(TaskStatus.DONE.isTerminal());
        assertTrue(TaskStatus.ESCALATED_RESOLVED.isTerminal());
        assertTrue(TaskStatus.ABORTED.isTerminal());
        assertTrue(TaskStatus.ESCALATED.isHalted());
        assertTrue(TaskStatus.AWAITING_INFORMATION.isHalted());
        assertFalse(TaskStatus.DISPATCHING.isTerminal());
    }

    // ===================================================================
    // Plan
    // ===================================================================

    @Nested
    @DisplayName("Plan")
    class PlanTests {

        private final Plan huntPlan = new Plan(
                List.of(step("S1", AgentId.HUNTING), step("S2", AgentId.TRIAGE),
                        step("S3", AgentId.RESPONSE), step("S4", AgentId.INTEL)),
                List.of(new DecisionPoint("D1", Condition.FINDINGS_PRESENT, "S1", List.of("S2", "S3", "S4"), List.of()),
                        new DecisionPoint("D2", Condition.HIGH_RISK, "S2", List.of("S3"), List.of())),
                "threat hunt", 0);

        @Test
        @DisplayName("Resolving true keeps the branch and drops only the decision point")
        void resolveTrue() {
            var resolved = huntPlan.resolve("D1", true);
            assertEquals(4, resolved.steps().size());
            assertEquals(List.of("D2"), resolved.decisionPoints().stream().map(DecisionPoint::id).toList());
            assertEquals(1, resolved.revision());
            assertFalse(resolved.isGuarded("S2"));
            assertTrue(resolved.isGuarded("S3"));
        }

        @Test
        @DisplayName("Resolving false drops the branch and decision points after dropped steps")
        void resolveFalse() {
            var resolved = huntPlan.resolve("D1", false);
            assertEquals(List.of("S1"), resolved.steps().stream().map(PlanStep::id).toList());
            assertTrue(resolved.decisionPoints().isEmpty());
        }

        @Test
        @DisplayName("Resolving an unknown decision point fails")
        void resolveUnknown() {
            assertThrows(IllegalArgumentException.class, () -> huntPlan.resolve("D9", true));
        }

        @Test
        @DisplayName("replaceRemaining keeps completed steps and appends the replacement")
        void replaceRemaining() {
            var replaced = huntPlan.replaceRemaining(Set.of("S1"),
                    List.of(step("R1", AgentId.INTEL)), List.of(), "reviewer plan");
            assertEquals(List.of("S1", "R1"), replaced.steps().stream().map(PlanStep::id).toList());
            assertTrue(replaced.decisionPoints().isEmpty());
            assertEquals("reviewer plan", replaced.note());
            assertEquals(1, replaced.revision());
        }

        @Test
        @DisplayName("Containment is a response step with the contain action")
        void containment() {
            assertTrue(new PlanStep("S1", AgentId.RESPONSE, "Contain", "", 1).isContainment());
            assertFalse(new PlanStep("S1", AgentId.HUNTING, "contain", "", 1).isContainment());
            assertFalse(new PlanStep("S1", AgentId.RESPONSE, "isolate", "", 1).isContainment());
        }

        @Test
        @DisplayName("Solo steps share a group with nothing")
        void soloSteps() {
            var solo = new PlanStep("S1", AgentId.INTEL, "x", "", null);
            assertFalse(solo.sharesGroupWith(solo));
            assertTrue(new PlanStep("S1", AgentId.INTEL, "x", "", 2)
                    .sharesGroupWith(new PlanStep("S2", AgentId.HUNTING, "y", "", 2)));
        }
    }

    // ===================================================================
    // TaskContext
    // ===================================================================

    @Nested
    @DisplayName("TaskContext")
    class ContextTests {

        @Test
        @DisplayName("A group with a failed member is recorded as partial throughout")
        void partialGroup() {
            var ok = success("S1", AgentId.RESPONSE, AgentDecision.MONITOR);
            var failed = failure("S2", AgentId.INTEL);
            var ctx = TaskContext.empty().appendAll(List.of(ok, failed));

            assertEquals(2, ctx.previousActions().size());
            assertTrue(ctx.previousActions().stream().allMatch(ActionRecord::partialGroup));
            assertFalse(ctx.hasSucceeded("S1"));
            assertTrue(ctx.committedActions().isEmpty());
            assertTrue(ctx.latestResponseFor("S1").isEmpty());
        }

        @Test
        @DisplayName("A single failed record is not a partial group")
        void singleFailure() {
            var ctx = TaskContext.empty().append(failure("S1", AgentId.HUNTING));
            assertFalse(ctx.previousActions().get(0).partialGroup());
            assertEquals(1, ctx.attempts("S1"));
        }

        @Test
        @DisplayName("Appending never rewrites earlier records")
        void appendOnly() {
            var first = TaskContext.empty().append(success("S1", AgentId.TRIAGE, AgentDecision.ESCALATE));
            var second = first.appendAll(List.of(success("S2", AgentId.INTEL, AgentDecision.MONITOR),
                    failure("S3", AgentId.HUNTING)));
            assertEquals(first.previousActions(), second.previousActions().subList(0, 1));
            assertTrue(second.hasSucceeded("S1"));
        }

        @Test
        @DisplayName("hasRecorded matches the exact committed response")
        void hasRecorded() {
            var record = success("S1", AgentId.HUNTING, AgentDecision.INVESTIGATE);
            var ctx = TaskContext.empty().append(record);
            assertTrue(ctx.hasRecorded("S1", record.response()));
            assertFalse(ctx.hasRecorded("S1", new AgentResponse(AgentId.HUNTING, "other", null, null, null, null)));
            assertFalse(ctx.hasRecorded("S2", record.response()));
        }

        @Test
        @DisplayName("Correlated alert ids accumulate from responses")
        void correlatedIds() {
            var response = new AgentResponse(AgentId.HUNTING, "x", null, null, null, Set.of("A-2"));
            var record = new ActionRecord("S1", AgentId.HUNTING, "hunt", 1, StepOutcome.SUCCEEDED, false,
                    response, null, null, null, 0L, false, Instant.now());
            var ctx = TaskContext.withRelatedIncidents(Set.of("INC-1")).append(record);
            assertEquals(Set.of("A-2"), ctx.correlatedAlertIds());
            assertEquals(Set.of("INC-1"), ctx.relatedIncidents());
        }

        @Test
        @DisplayName("latestResponseFrom returns the most recent committed response of an agent")
        void latestFromAgent() {
            var ctx = TaskContext.empty()
                    .append(success("S1", AgentId.INTEL, AgentDecision.MONITOR))
                    .append(success("S2", AgentId.INTEL, AgentDecision.ESCALATE));
            assertEquals(AgentDecision.ESCALATE, ctx.latestResponseFrom(AgentId.INTEL).orElseThrow().decision());
            assertTrue(ctx.latestResponseFrom(AgentId.HUNTING).isEmpty());
        }
    }

    // ===================================================================
    // Helpers
    // ===================================================================

    static PlanStep step(String id, AgentId agent) {
        return new PlanStep(id, agent, "act", "", null);
    }

    static ActionRecord success(String stepId, AgentId agent, AgentDecision decision) {
        return new ActionRecord(stepId, agent, "act", 1, StepOutcome.SUCCEEDED, false,
                new AgentResponse(agent, "findings of " + stepId, null, null, decision, Set.of()),
                null, null, null, 5L, false, Instant.now());
    }

    static ActionRecord failure(String stepId, AgentId agent) {
        return new ActionRecord(stepId, agent, "act", 1, StepOutcome.FAILED, false, null,
                ProviderFailure.TIMEOUT, "timed out", null, 5L, false, Instant.now());
    }
}
