package com.socmind.core.graph;

import com.socmind.core.model.TaskStatus;
import com.socmind.core.nodes.BuildPlanNode;
import com.socmind.core.nodes.DispatchGroupNode;
import com.socmind.core.nodes.DispatchTriageNode;
import com.socmind.core.nodes.ReceiveTaskNode;
import com.socmind.core.nodes.ScheduleGroupNode;
import com.socmind.core.nodes.SynthesizeNode;
import com.socmind.core.state.TaskState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives a task through
 * its lifecycle.
 * <pre>
 *   START -&gt; receive -&gt; [routeAfterReceive]
 *      -&gt; dispatch_triage -&gt; [routeAfterTriage]
 *            -&gt; build_plan | synthesize (aborted) | END (escalated)
 *      -&gt; build_plan -&gt; [routeAfterPlan]
 *            -&gt; schedule_group | synthesize (empty plan)
 *      -&gt; schedule_group -&gt; [routeAfterSchedule]
 *            -&gt; dispatch_group -&gt; [routeAfterDispatch]
 *                  -&gt; schedule_group (next group) | synthesize (aborted) | END (escalated)
 *            -&gt; synthesize (no steps left) | END (escalated or awaiting information)
 *      -&gt; synthesize (aborted by a reviewer) -&gt; END
 * </pre>
 * A run that halts ends at END with the task Escalated or AwaitingInformation; the engine
 * resumes it by invoking the graph again with the stored state.
 */
@Component
public class TaskGraph {

    private static final Logger log = LoggerFactory.getLogger(TaskGraph.class);

    private final CompiledGraph<TaskState> compiledGraph;

    public TaskGraph(ReceiveTaskNode receiveNode,
                     DispatchTriageNode triageNode,
                     BuildPlanNode planNode,
                     ScheduleGroupNode scheduleNode,
                     DispatchGroupNode dispatchNode,
                     SynthesizeNode synthesizeNode,
                     GraphProperties properties) throws GraphStateException {

        var graph = new StateGraph<>(TaskState.SCHEMA, TaskState::new)
                .addNode("receive", node_async(receiveNode::apply))
                .addNode("dispatch_triage", node_async(triageNode::apply))
                .addNode("build_plan", node_async(planNode::apply))
                .addNode("schedule_group", node_async(scheduleNode::apply))
                .addNode("dispatch_group", node_async(dispatchNode::apply))
                .addNode("synthesize", node_async(synthesizeNode::apply))
                .addEdge(START, "receive")
                .addConditionalEdges("receive",
                        edge_async(this::routeAfterReceive),
                        Map.of("dispatch_triage", "dispatch_triage",
                                "build_plan", "build_plan",
                                "schedule_group", "schedule_group",
                                "synthesize", "synthesize"))
                .addConditionalEdges("dispatch_triage",
                        edge_async(this::routeAfterTriage),
                        Map.of("build_plan", "build_plan",
                                "synthesize", "synthesize",
                                END, END))
                .addConditionalEdges("build_plan",
                        edge_async(this::routeAfterPlan),
                        Map.of("schedule_group", "schedule_group",
                                "synthesize", "synthesize"))
                .addConditionalEdges("schedule_group",
                        edge_async(this::routeAfterSchedule),
                        Map.of("dispatch_group", "dispatch_group",
                                "synthesize", "synthesize",
                                END, END))
                .addConditionalEdges("dispatch_group",
                        edge_async(this::routeAfterDispatch),
                        Map.of("schedule_group", "schedule_group",
                                "synthesize", "synthesize",
                                END, END))
                .addEdge("synthesize", END);

        var config = CompileConfig.builder()
                .recursionLimit(properties.recursionLimit())
                .build();
        this.compiledGraph = graph.compile(config);
        log.info("Task graph compiled with recursion limit {}", properties.recursionLimit());
    }

    /**
     * Alert work without a triage result goes to triage first, whatever else the state holds.
     * A reviewer's Modify-plan cannot skip it.
     */
    String routeAfterReceive(TaskState state) {
        if (state.status() == TaskStatus.ABORTED) {
            return "synthesize";
        }
        var task = state.task();
        if (task.requiresTriageFirst()) {
            boolean triaged = state.context().hasSucceeded(DispatchTriageNode.TRIAGE_STEP_ID);
            if (!triaged || (state.riskTier().isEmpty() && state.plan().isEmpty())) {
                return "dispatch_triage";
            }
        }
        if (state.plan().isEmpty()) {
            return "build_plan";
        }
        return "schedule_group";
    }

    String routeAfterTriage(TaskState state) {
        return switch (state.status()) {
            case ABORTED -> "synthesize";
            case ESCALATED, AWAITING_INFORMATION -> END;
            default -> "build_plan";
        };
    }

    String routeAfterPlan(TaskState state) {
        return state.plan().map(p -> p.isEmpty()).orElse(true) ? "synthesize" : "schedule_group";
    }

    String routeAfterSchedule(TaskState state) {
        return switch (state.status()) {
            case ESCALATED, AWAITING_INFORMATION -> END;
            case SYNTHESIZING -> "synthesize";
            default -> "dispatch_group";
        };
    }

    String routeAfterDispatch(TaskState state) {
        return switch (state.status()) {
            case ABORTED -> "synthesize";
            case ESCALATED, AWAITING_INFORMATION -> END;
            default -> "schedule_group";
        };
    }

    public CompiledGraph<TaskState> getCompiledGraph() {
        return compiledGraph;
    }
}
