package com.socmind.core.state;

import com.socmind.core.model.AuditRecord;
import com.socmind.core.model.EscalationEvent;
import com.socmind.core.model.HumanDecision;
import com.socmind.core.model.Plan;
import com.socmind.core.model.RiskTier;
import com.socmind.core.model.Task;
import com.socmind.core.model.TaskContext;
import com.socmind.core.model.TaskStatus;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Graph state for one task run.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. Nodes return partial
 * updates; every channel except {@code errors} is replaced wholesale, so nodes that
 * extend a collection write the full new value.
 */
public class TaskState extends AgentState {

    public static final String TASK_ID = "taskId";
    public static final String TASK = "task";
    public static final String STATUS = "status";
    public static final String RISK_TIER = "riskTier";
    public static final String PLAN = "plan";
    public static final String CONTEXT = "context";
    public static final String COMPLETED_STEP_IDS = "completedStepIds";
    public static final String GROUP_STEP_IDS = "groupStepIds";
    public static final String GROUP_COUNT = "groupCount";
    public static final String RETRIED_STEP_IDS = "retriedStepIds";
    public static final String ACKNOWLEDGED_TRIGGERS = "acknowledgedTriggers";
    public static final String ESCALATION = "escalation";
    public static final String ESCALATIONS = "escalations";
    public static final String HUMAN_DECISIONS = "humanDecisions";
    public static final String TERMINATION_REASON = "terminationReason";
    public static final String AUDIT = "audit";
    public static final String ERRORS = "errors";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Scalar channels ──────────────────────────────────────────
        Map.entry(TASK_ID,               Channels.base(() -> "")),
        Map.entry(TASK,                  Channels.base((Reducer<Task>) null)),
        Map.entry(STATUS,                Channels.base(() -> TaskStatus.RECEIVED.name())),
        Map.entry(RISK_TIER,             Channels.base(() -> "")),
        Map.entry(PLAN,                  Channels.base((Reducer<Plan>) null)),
        Map.entry(CONTEXT,               Channels.base((Reducer<TaskContext>) null)),
        Map.entry(GROUP_COUNT,           Channels.base(() -> 0)),
        Map.entry(ESCALATION,            Channels.base((Reducer<EscalationEvent>) null)),
        Map.entry(TERMINATION_REASON,    Channels.base(() -> "")),
        Map.entry(AUDIT,                 Channels.base((Reducer<AuditRecord>) null)),

        // ── Collection channels (replaced wholesale) ─────────────────
        Map.entry(COMPLETED_STEP_IDS,    Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(GROUP_STEP_IDS,        Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(RETRIED_STEP_IDS,      Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(ACKNOWLEDGED_TRIGGERS, Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(ESCALATIONS,           Channels.base((Supplier<List<EscalationEvent>>) List::of)),
        Map.entry(HUMAN_DECISIONS,       Channels.base((Supplier<List<HumanDecision>>) List::of)),

        // ── Appender channels (list accumulation) ────────────────────
        Map.entry(ERRORS,                Channels.appender(ArrayList::new))
    );

    public TaskState(Map<String, Object> initData) {
        super(initData);
    }

    // ── Scalar accessors ─────────────────────────────────────────────

    public String taskId() {
        return this.<String>value(TASK_ID).orElse("");
    }

    public Task task() {
        return this.<Task>value(TASK)
                .orElseThrow(() -> new IllegalStateException("State has no task"));
    }

    public TaskStatus status() {
        String raw = this.<String>value(STATUS).orElse(TaskStatus.RECEIVED.name());
        return TaskStatus.valueOf(raw);
    }

    public Optional<RiskTier> riskTier() {
        return this.<String>value(RISK_TIER)
                .filter(s -> !s.isBlank())
                .map(RiskTier::valueOf);
    }

    public Optional<Plan> plan() {
        return value(PLAN);
    }

    public TaskContext context() {
        return this.<TaskContext>value(CONTEXT).orElseGet(() -> task().context());
    }

    public int groupCount() {
        return this.<Integer>value(GROUP_COUNT).orElse(0);
    }

    /** The escalation currently blocking dispatch, if any. */
    public Optional<EscalationEvent> escalation() {
        return value(ESCALATION);
    }

    public String terminationReason() {
        return this.<String>value(TERMINATION_REASON).orElse("");
    }

    public Optional<AuditRecord> audit() {
        return value(AUDIT);
    }

    // ── Collection accessors ─────────────────────────────────────────

    public Set<String> completedStepIds() {
        return new LinkedHashSet<>(this.<List<String>>value(COMPLETED_STEP_IDS).orElse(List.of()));
    }

    public List<String> groupStepIds() {
        return this.<List<String>>value(GROUP_STEP_IDS).orElse(List.of());
    }

    public Set<String> retriedStepIds() {
        return new LinkedHashSet<>(this.<List<String>>value(RETRIED_STEP_IDS).orElse(List.of()));
    }

    public Set<String> acknowledgedTriggers() {
        return new LinkedHashSet<>(this.<List<String>>value(ACKNOWLEDGED_TRIGGERS).orElse(List.of()));
    }

    public List<EscalationEvent> escalations() {
        return this.<List<EscalationEvent>>value(ESCALATIONS).orElse(List.of());
    }

    public List<HumanDecision> humanDecisions() {
        return this.<List<HumanDecision>>value(HUMAN_DECISIONS).orElse(List.of());
    }

    public List<String> errors() {
        return this.<List<String>>value(ERRORS).orElse(List.of());
    }
}
