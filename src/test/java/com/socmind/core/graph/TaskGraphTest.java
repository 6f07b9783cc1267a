package com.socmind.core.graph;

import com.socmind.core.model.ActionRecord;
import com.socmind.core.model.AgentDecision;
import com.socmind.core.model.AgentId;
import com.socmind.core.model.AgentResponse;
import com.socmind.core.model.Alert;
import com.socmind.core.model.Plan;
import com.socmind.core.model.PlanStep;
import com.socmind.core.model.RiskTier;
import com.socmind.core.model.Severity;
import com.socmind.core.model.StepOutcome;
import com.socmind.core.model.Task;
import com.socmind.core.model.TaskContext;
import com.socmind.core.model.TaskStatus;
import com.socmind.core.model.TaskType;
import com.socmind.core.nodes.BuildPlanNode;
import com.socmind.core.nodes.DispatchGroupNode;
import com.socmind.core.nodes.DispatchTriageNode;
import com.socmind.core.nodes.ReceiveTaskNode;
import com.socmind.core.nodes.ScheduleGroupNode;
import com.socmind.core.nodes.SynthesizeNode;
import com.socmind.core.state.TaskState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class TaskGraphTest {

    private TaskGraph graph;

    private static final Task ALERT_TASK = new Task("T-1", TaskType.ALERT_ANALYSIS, "",
            new Alert("A-1", "x", Severity.HIGH, "", Set.of(), Set.of(), List.of()), TaskContext.empty());
    private static final Task HUNT_TASK = new Task("T-2", TaskType.THREAT_HUNT, "", null, TaskContext.empty());
    private static final Plan PLAN = new Plan(List.of(new PlanStep("S1", AgentId.HUNTING, "hunt", "", null)),
            List.of(), "", 0);

    @BeforeEach
    void setUp() throws Exception {
        graph = new TaskGraph(mock(ReceiveTaskNode.class), mock(DispatchTriageNode.class),
                mock(BuildPlanNode.class), mock(ScheduleGroupNode.class), mock(DispatchGroupNode.class),
                mock(SynthesizeNode.class), new GraphProperties());
    }

    @Test
    @DisplayName("The graph compiles")
    void compiles() {
        assertNotNull(graph.getCompiledGraph());
    }

    @Test
    @DisplayName("The recursion limit leaves room for a plan at the size cap")
    void recursionLimitCoversLargestPlan() {
        var properties = new GraphProperties();
        properties.setMaxPlanSteps(12);
        // receive, triage, build, then schedule and dispatch per step and per re-dispatch, last schedule, synthesize
        int worstCase = 3 + 2 * (12 + 12) + 2;
        assertTrue(properties.recursionLimit() >= worstCase);
        assertTrue(new GraphProperties().recursionLimit() > 25);
    }

    // ===================================================================
    // Entry routing
    // ===================================================================

    @Nested
    @DisplayName("routeAfterReceive")
    class AfterReceive {

        @Test
        @DisplayName("Fresh alert work goes to triage")
        void alertToTriage() {
            assertEquals("dispatch_triage", graph.routeAfterReceive(state(ALERT_TASK, Map.of())));
        }

        @Test
        @DisplayName("A plan without a triage result still goes to triage first")
        void planCannotSkipTriage() {
            assertEquals("dispatch_triage", graph.routeAfterReceive(state(ALERT_TASK, Map.of(TaskState.PLAN, PLAN))));
        }

        @Test
        @DisplayName("Triaged alert work builds its plan")
        void triagedToPlan() {
            var ctx = TaskContext.empty().append(triageRecord());
            assertEquals("build_plan", graph.routeAfterReceive(state(ALERT_TASK, Map.of(
                    TaskState.CONTEXT, ctx, TaskState.RISK_TIER, RiskTier.HIGH.name()))));
        }

        @Test
        @DisplayName("Other work skips triage")
        void huntToPlan() {
            assertEquals("build_plan", graph.routeAfterReceive(state(HUNT_TASK, Map.of())));
            assertEquals("schedule_group", graph.routeAfterReceive(state(HUNT_TASK, Map.of(TaskState.PLAN, PLAN))));
        }

        @Test
        @DisplayName("An aborted resume only synthesizes")
        void aborted() {
            assertEquals("synthesize", graph.routeAfterReceive(state(ALERT_TASK,
                    Map.of(TaskState.STATUS, TaskStatus.ABORTED.name()))));
        }
    }

    // ===================================================================
    // Halting and progression
    // ===================================================================

    @Test
    @DisplayName("Halted states end the run")
    void halts() {
        var escalated = state(HUNT_TASK, Map.of(TaskState.STATUS, TaskStatus.ESCALATED.name()));
        var waiting = state(HUNT_TASK, Map.of(TaskState.STATUS, TaskStatus.AWAITING_INFORMATION.name()));

        assertEquals(END, graph.routeAfterTriage(escalated));
        assertEquals(END, graph.routeAfterSchedule(escalated));
        assertEquals(END, graph.routeAfterSchedule(waiting));
        assertEquals(END, graph.routeAfterDispatch(escalated));
    }

    @Test
    @DisplayName("Normal progression moves through plan, schedule and dispatch")
    void progression() {
        assertEquals("build_plan", graph.routeAfterTriage(state(ALERT_TASK,
                Map.of(TaskState.STATUS, TaskStatus.TRIAGE_DONE.name()))));
        assertEquals("schedule_group", graph.routeAfterPlan(state(HUNT_TASK, Map.of(TaskState.PLAN, PLAN))));
        assertEquals("synthesize", graph.routeAfterPlan(state(HUNT_TASK,
                Map.of(TaskState.PLAN, new Plan(List.of(), List.of(), "record + monitor", 0)))));
        assertEquals("dispatch_group", graph.routeAfterSchedule(state(HUNT_TASK,
                Map.of(TaskState.STATUS, TaskStatus.DISPATCHING.name()))));
        assertEquals("synthesize", graph.routeAfterSchedule(state(HUNT_TASK,
                Map.of(TaskState.STATUS, TaskStatus.SYNTHESIZING.name()))));
        assertEquals("schedule_group", graph.routeAfterDispatch(state(HUNT_TASK,
                Map.of(TaskState.STATUS, TaskStatus.DISPATCHING.name()))));
        assertEquals("synthesize", graph.routeAfterDispatch(state(HUNT_TASK,
                Map.of(TaskState.STATUS, TaskStatus.ABORTED.name()))));
    }

    private static TaskState state(Task task, Map<String, Object> values) {
        var data = new HashMap<String, Object>(values);
        data.put(TaskState.TASK_ID, task.id());
        data.put(TaskState.TASK, task);
        return new TaskState(data);
    }

    private static ActionRecord triageRecord() {
        return new ActionRecord(DispatchTriageNode.TRIAGE_STEP_ID, AgentId.TRIAGE, "triage", 1,
                StepOutcome.SUCCEEDED, false,
                new AgentResponse(AgentId.TRIAGE, "x", 85, null, AgentDecision.ESCALATE, Set.of()),
                null, null, null, 1L, false, Instant.now());
    }
}
