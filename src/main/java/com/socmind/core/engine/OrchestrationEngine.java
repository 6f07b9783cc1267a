package com.socmind.core.engine;

import com.socmind.core.audit.AuditSink;
import com.socmind.core.context.ContextStore;
import com.socmind.core.escalation.EscalationResolver;
import com.socmind.core.escalation.EscalationSink;
import com.socmind.core.events.EventBus;
import com.socmind.core.events.SocmindEvent;
import com.socmind.core.graph.TaskGraph;
import com.socmind.core.logging.MdcContext;
import com.socmind.core.metrics.SocmindMetrics;
import com.socmind.core.model.AgentId;
import com.socmind.core.model.AgentResponse;
import com.socmind.core.model.AuditRecord;
import com.socmind.core.model.EscalationReason;
import com.socmind.core.model.HumanDecision;
import com.socmind.core.model.InvalidTaskException;
import com.socmind.core.model.Task;
import com.socmind.core.model.TaskContext;
import com.socmind.core.model.TaskStatus;
import com.socmind.core.model.TaskSubmission;
import com.socmind.core.model.TaskType;
import com.socmind.core.nodes.DispatchTriageNode;
import com.socmind.core.risk.RiskClassifier;
import com.socmind.core.state.TaskState;
import com.socmind.provider.ProviderDispatcher;
import jakarta.annotation.PreDestroy;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the task lifecycle: validates and accepts submissions, runs them through the
 * {@link TaskGraph}, and resumes halted tasks when a reviewer decides or missing
 * information arrives.
 * <p>
 * Each task has at most one graph run at a time. A run that halts raises its pending
 * escalation; a run that terminates emits the audit record.
 */
@Service
public class OrchestrationEngine {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationEngine.class);
    private static final AtomicInteger TASK_COUNTER = new AtomicInteger(0);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);
    private static final Set<EscalationReason> PROVIDER_FAILURES = EnumSet.of(
            EscalationReason.PROVIDER_TIMEOUT, EscalationReason.PROVIDER_UNAVAILABLE,
            EscalationReason.MALFORMED_RESPONSE);

    private final TaskGraph taskGraph;
    private final TaskRegistry registry;
    private final EscalationResolver resolver;
    private final ContextStore contextStore;
    private final RiskClassifier riskClassifier;
    private final EscalationSink escalationSink;
    private final AuditSink auditSink;
    private final ProviderDispatcher dispatcher;
    private final EventBus eventBus;
    private final SocmindMetrics metrics;
    private final ExecutorService runner = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "task-runner-" + THREAD_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public OrchestrationEngine(TaskGraph taskGraph, TaskRegistry registry, EscalationResolver resolver,
                               ContextStore contextStore, RiskClassifier riskClassifier,
                               EscalationSink escalationSink, AuditSink auditSink,
                               ProviderDispatcher dispatcher, EventBus eventBus, SocmindMetrics metrics) {
        this.taskGraph = taskGraph;
        this.registry = registry;
        this.resolver = resolver;
        this.contextStore = contextStore;
        this.riskClassifier = riskClassifier;
        this.escalationSink = escalationSink;
        this.auditSink = auditSink;
        this.dispatcher = dispatcher;
        this.eventBus = eventBus;
        this.metrics = metrics;
        eventBus.subscribeAll(this::trackStatus);
    }

    @PreDestroy
    public void shutdown() {
        runner.shutdownNow();
    }

    /**
     * Validates a submission and assigns it an id.
     *
     * @throws InvalidTaskException if the task cannot enter the state machine
     */
    public Task accept(TaskSubmission submission) {
        if (submission == null || submission.taskType() == null) {
            throw new InvalidTaskException("Task type is required");
        }
        if (submission.taskType() == TaskType.ALERT_ANALYSIS && submission.alert() == null) {
            throw new InvalidTaskException("alert_analysis tasks require an alert");
        }
        if (submission.alert() != null && submission.alert().severity() == null) {
            throw new InvalidTaskException("Alert severity is required");
        }
        return new Task(generateTaskId(), submission.taskType(),
                submission.description() == null ? "" : submission.description(),
                submission.alert(), TaskContext.withRelatedIncidents(submission.relatedIncidents()));
    }

    /**
     * Accepts the task and starts it in the background.
     *
     * @return the task id
     * @throws InvalidTaskException if the task is rejected
     */
    public String submit(TaskSubmission submission) {
        var task = accept(submission);
        var tracked = registry.register(task);

        var stateMap = new HashMap<String, Object>();
        stateMap.put(TaskState.TASK_ID, task.id());
        stateMap.put(TaskState.TASK, task);
        stateMap.put(TaskState.STATUS, TaskStatus.RECEIVED.name());
        stateMap.put(TaskState.CONTEXT, task.context());

        synchronized (tracked) {
            launch(tracked, Map.copyOf(stateMap));
        }
        return task.id();
    }

    /**
     * Runs a task until it terminates or halts for review.
     */
    public TaskState runTask(TaskSubmission submission) {
        var taskId = submit(submission);
        return registry.get(taskId).currentRun().join();
    }

    /**
     * Records a reviewer's decision on a halted task and resumes it in the background.
     *
     * @throws com.socmind.core.model.TaskNotFoundException if the task is unknown
     * @throws IllegalStateException    if the task is not halted on an escalation
     * @throws IllegalArgumentException if the decision is incomplete
     */
    public CompletableFuture<TaskState> resolve(String taskId, HumanDecision decision) {
        var tracked = registry.get(taskId);
        synchronized (tracked) {
            var state = haltedState(tracked);
            var data = resolver.apply(state, decision);
            if (TaskStatus.ABORTED.name().equals(data.get(TaskState.STATUS))) {
                dispatcher.cancelAll(taskId);
            }
            escalationSink.resolved(taskId, decision);
            eventBus.publish(SocmindEvent.of("decision.recorded", taskId, null,
                    Map.of("type", decision.type().name(),
                           "reviewer", String.valueOf(decision.reviewer()))));
            return launch(tracked, data);
        }
    }

    /**
     * Records a response supplied for a step of a halted task and resumes it. Supplying a
     * response already recorded for that step changes nothing.
     *
     * Only a task awaiting information, or one escalated because the provider for that very
     * step failed, accepts a supplied response. Other escalations need a reviewer's decision.
     *
     * @throws IllegalStateException    if the task is not waiting on that step
     * @throws IllegalArgumentException if the step is unknown or the response does not fit it
     */
    public CompletableFuture<TaskState> supplyResponse(String taskId, String stepId, AgentResponse response) {
        var tracked = registry.get(taskId);
        synchronized (tracked) {
            var last = tracked.state().orElseThrow(() ->
                    new IllegalStateException("Task " + taskId + " has not run yet"));
            if (last.context().hasRecorded(stepId, response)) {
                log.info("Task {}: response for {} already recorded", taskId, stepId);
                return CompletableFuture.completedFuture(last);
            }
            var state = haltedState(tracked);
            if (!acceptsSupplied(state, stepId)) {
                throw new IllegalStateException("Task %s is %s on %s; it needs a reviewer's decision"
                        .formatted(taskId, state.status(),
                                state.escalation().map(e -> e.reason().name()).orElse("no escalation")));
            }
            boolean triage = DispatchTriageNode.TRIAGE_STEP_ID.equals(stepId);
            var step = triage ? null : state.plan().flatMap(p -> p.step(stepId)).orElseThrow(() ->
                    new IllegalArgumentException("Task " + taskId + " has no step " + stepId));
            var expectedAgent = triage ? AgentId.TRIAGE : step.agentId();
            if (response.agentId() != expectedAgent) {
                throw new IllegalArgumentException("Step %s expects a response from %s"
                        .formatted(stepId, expectedAgent.wireName()));
            }

            var data = new HashMap<String, Object>(state.data());
            data.remove(TaskState.ESCALATION);
            data.put(TaskState.CONTEXT, contextStore.recordSupplied(state.context(), stepId, expectedAgent,
                    triage ? "triage" : step.action(), response));
            if (triage) {
                if (!riskClassifier.isValidScore(response.riskScore())) {
                    throw new IllegalArgumentException("A supplied triage response needs a risk score in 0..100");
                }
                data.put(TaskState.RISK_TIER, riskClassifier.classify(response.riskScore()).name());
                data.put(TaskState.STATUS, TaskStatus.TRIAGE_DONE.name());
            } else {
                var completed = new ArrayList<>(state.completedStepIds());
                if (!completed.contains(stepId)) {
                    completed.add(stepId);
                }
                data.put(TaskState.COMPLETED_STEP_IDS, List.copyOf(completed));
                data.put(TaskState.STATUS, TaskStatus.DISPATCHING.name());
            }
            escalationSink.resolved(taskId, null);
            eventBus.publish(SocmindEvent.of("information.supplied", taskId, stepId,
                    Map.of("agent", expectedAgent.wireName())));
            return launch(tracked, data);
        }
    }

    /**
     * Generates a unique task ID in the format SOC-YYYY-NNNN.
     */
    public String generateTaskId() {
        int count = TASK_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("SOC-%d-%04d", year, count);
    }

    private TaskState haltedState(TaskRegistry.TrackedTask tracked) {
        if (tracked.isRunning()) {
            throw new IllegalStateException("Task " + tracked.task().id() + " is running");
        }
        var state = tracked.state().orElseThrow(() ->
                new IllegalStateException("Task " + tracked.task().id() + " has not run yet"));
        if (!state.status().isHalted()) {
            throw new IllegalStateException("Task %s is %s, not awaiting a decision"
                    .formatted(tracked.task().id(), state.status()));
        }
        return state;
    }

    private static boolean acceptsSupplied(TaskState state, String stepId) {
        if (state.status() == TaskStatus.AWAITING_INFORMATION) {
            return true;
        }
        return state.escalation()
                .filter(e -> PROVIDER_FAILURES.contains(e.reason()))
                .filter(e -> stepId.equals(e.triggeringStep()))
                .isPresent();
    }

    private CompletableFuture<TaskState> launch(TaskRegistry.TrackedTask tracked, Map<String, Object> data) {
        int runNumber = tracked.nextRunNumber();
        var run = CompletableFuture.supplyAsync(() -> execute(tracked, data, runNumber), runner);
        tracked.startRun(run);
        return run;
    }

    private TaskState execute(TaskRegistry.TrackedTask tracked, Map<String, Object> data, int runNumber) {
        var task = tracked.task();
        MdcContext.setTask(task.id());
        try {
            log.info("Starting run {} of task {} ({})", runNumber, task.id(), task.taskType().wireName());
            // Each run gets its own thread id; the full state is passed in as input.
            var config = RunnableConfig.builder()
                    .threadId(task.id() + "-run" + runNumber)
                    .build();
            var state = taskGraph.getCompiledGraph()
                    .invoke(data, config)
                    .orElseThrow(() -> new IllegalStateException(
                            "Graph execution returned empty state for task " + task.id()));
            tracked.finishRun(state);
            afterRun(state);
            return state;
        } catch (RuntimeException e) {
            log.error("Run {} of task {} failed: {}", runNumber, task.id(), e.getMessage(), e);
            tracked.updateStatus(TaskStatus.ABORTED);
            dispatcher.cancelAll(task.id());
            auditSink.emit(failureAudit(task, tracked, e));
            eventBus.release(task.id());
            metrics.recordTaskResult(task.taskType().wireName(), TaskStatus.ABORTED.name());
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private void afterRun(TaskState state) {
        var status = state.status();
        if (status.isHalted()) {
            state.escalation().ifPresent(escalationSink::raise);
            log.info("Task {} halted in {}", state.taskId(), status);
            return;
        }
        if (status.isTerminal()) {
            if (status == TaskStatus.ABORTED) {
                dispatcher.cancelAll(state.taskId());
            }
            state.audit().ifPresent(auditSink::emit);
            metrics.recordTaskResult(state.task().taskType().wireName(), status.name());
            dispatcher.release(state.taskId());
            eventBus.release(state.taskId());
        }
    }

    private AuditRecord failureAudit(Task task, TaskRegistry.TrackedTask tracked, RuntimeException e) {
        var last = tracked.state();
        return new AuditRecord(task.id(), task.taskType(), TaskStatus.ABORTED,
                last.flatMap(TaskState::riskTier).orElse(null),
                last.map(s -> s.context().previousActions()).orElse(List.of()),
                List.of(), List.of(), List.of("Task stopped by an engine error"),
                last.map(TaskState::escalations).orElse(List.of()),
                last.map(TaskState::humanDecisions).orElse(List.of()),
                "ABORTED", "Engine error: " + e.getMessage(), Instant.now());
    }

    private void trackStatus(SocmindEvent event) {
        if (!SocmindEvent.STATUS_CHANGED.equals(event.eventType())) {
            return;
        }
        registry.find(event.taskId()).ifPresent(t ->
                t.updateStatus(TaskStatus.valueOf((String) event.payload().get("status"))));
    }
}
