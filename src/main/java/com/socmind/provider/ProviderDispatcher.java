package com.socmind.provider;

import com.socmind.core.events.EventBus;
import com.socmind.core.events.SocmindEvent;
import com.socmind.core.logging.MdcContext;
import com.socmind.core.metrics.SocmindMetrics;
import com.socmind.core.model.ActionRecord;
import com.socmind.core.model.AgentId;
import com.socmind.core.model.AgentResponse;
import com.socmind.core.model.PlanStep;
import com.socmind.core.model.ProviderFailure;
import com.socmind.core.model.StepOutcome;
import com.socmind.core.model.Task;
import com.socmind.core.model.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Invokes capability providers on behalf of the engine.
 * <p>
 * Each invocation runs under its own timeout. Timeouts and unavailability are retried
 * once after a backoff; malformed responses and unregistered providers are not. Every
 * response is validated before it is handed back. All members of a group are dispatched
 * concurrently, bounded by a semaphore at {@code maxParallel}, and joined before the
 * group result is returned.
 * <p>
 * The wait on one step is measured across both attempts and the backoff between them.
 * A step whose total wait passes its provider's timeout is flagged on its record, even
 * when the retry succeeded.
 */
@Service
public class ProviderDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ProviderDispatcher.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final ProviderRegistry registry;
    private final ProviderProperties properties;
    private final EventBus eventBus;
    private final SocmindMetrics metrics;
    private final ExecutorService executor;

    /** In-flight provider calls per task, so an abort can cancel them. */
    private final ConcurrentHashMap<String, Set<Future<?>>> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public ProviderDispatcher(ProviderRegistry registry, ProviderProperties properties,
                              EventBus eventBus, SocmindMetrics metrics) {
        this.registry = registry;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "provider-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    ProviderDispatcher(ProviderRegistry registry, ProviderProperties properties) {
        this(registry, properties, new EventBus(), null);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    /**
     * Dispatches every step of a group and waits for all of them to succeed, fail or time out.
     *
     * @param groupNumber ordinal of the group within the task, for logging and records
     */
    public DispatchResult dispatchGroup(Task task, List<PlanStep> steps, TaskContext context, int groupNumber) {
        String taskId = task.id();
        var semaphore = new Semaphore(Math.max(1, properties.getMaxParallel()));
        var futures = new ArrayList<CompletableFuture<ActionRecord>>();
        long startMs = System.currentTimeMillis();

        for (var step : steps) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                MdcContext.setGroup(taskId, groupNumber);
                try {
                    semaphore.acquire();
                    try {
                        return dispatchStep(task, step, context, groupNumber);
                    } finally {
                        semaphore.release();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return failureRecord(step, context.attempts(step.id()) + 1, groupNumber,
                            ProviderFailure.UNAVAILABLE, "Interrupted: " + e.getMessage(), 0L);
                } finally {
                    MdcContext.clear();
                }
            }, executor));
        }

        var records = new ArrayList<ActionRecord>();
        for (int i = 0; i < futures.size(); i++) {
            var step = steps.get(i);
            try {
                records.add(futures.get(i).join());
            } catch (RuntimeException e) {
                log.error("Unexpected error collecting result for step {}", step.id(), e);
                records.add(failureRecord(step, context.attempts(step.id()) + 1, groupNumber,
                        ProviderFailure.UNAVAILABLE, e.getMessage(), 0L));
            }
        }
        long elapsedMs = System.currentTimeMillis() - startMs;
        if (metrics != null) {
            metrics.recordGroupExecution(steps.size(), records.stream().anyMatch(r -> !r.succeeded()));
        }
        return new DispatchResult(groupNumber, records, elapsedMs);
    }

    /**
     * Dispatches one step, retrying a transient failure once.
     */
    public ActionRecord dispatchStep(Task task, PlanStep step, TaskContext context, Integer groupNumber) {
        String taskId = task.id();
        AgentId agentId = step.agentId();
        MdcContext.setStep(taskId, step.id(), agentId.wireName());
        try {
            int priorAttempts = context.attempts(step.id());
            var snapshot = new TaskSnapshot(task, step.id(), step.action(), step.rationale());
            long startMs = System.currentTimeMillis();

            eventBus.publish(SocmindEvent.of("step.started", taskId, step.id(),
                    Map.of("agent", agentId.wireName(), "action", step.action())));

            ProviderException lastFailure = null;
            int tries = 0;
            while (tries < 2) {
                tries++;
                if (tries > 1) {
                    log.info("Retrying step {} [{}] after {}: {}", step.id(), agentId.wireName(),
                            lastFailure.failure(), lastFailure.getMessage());
                    if (!backoff()) {
                        break;
                    }
                }
                try {
                    var response = invokeOnce(taskId, agentId, snapshot, context);
                    long elapsedMs = System.currentTimeMillis() - startMs;
                    boolean slow = waitExceeded(taskId, step, elapsedMs);
                    log.info("Step {} [{}] succeeded in {} ms (risk={}, decision={})", step.id(),
                            agentId.wireName(), elapsedMs, response.riskScore(), response.decision());
                    if (metrics != null) {
                        metrics.recordProviderCall(agentId.wireName(), elapsedMs, true);
                    }
                    eventBus.publish(SocmindEvent.of("step.completed", taskId, step.id(),
                            completedPayload(agentId, response)));
                    return new ActionRecord(step.id(), agentId, step.action(), priorAttempts + tries,
                            StepOutcome.SUCCEEDED, false, response, null, null, groupNumber,
                            elapsedMs, slow, Instant.now());
                } catch (ProviderException e) {
                    lastFailure = e;
                    log.warn("Step {} [{}] attempt {} failed: {} {}", step.id(), agentId.wireName(),
                            priorAttempts + tries, e.failure(), e.getMessage());
                    if (!e.failure().isTransient()) {
                        break;
                    }
                }
            }

            long elapsedMs = System.currentTimeMillis() - startMs;
            if (metrics != null) {
                metrics.recordProviderCall(agentId.wireName(), elapsedMs, false);
                metrics.recordProviderFailure(agentId.wireName(), lastFailure.failure().name());
            }
            eventBus.publish(SocmindEvent.of("step.failed", taskId, step.id(),
                    Map.of("agent", agentId.wireName(),
                           "failure", lastFailure.failure().name(),
                           "error", String.valueOf(lastFailure.getMessage()))));
            var failed = failureRecord(step, priorAttempts + tries, groupNumber, lastFailure.failure(),
                    lastFailure.getMessage(), elapsedMs);
            return waitExceeded(taskId, step, elapsedMs) ? failed.withWaitExceeded() : failed;
        } finally {
            MdcContext.clearStep();
        }
    }

    /**
     * Cancels every outstanding provider call for the task.
     *
     * @return number of calls cancelled
     */
    public int cancelAll(String taskId) {
        var futures = inFlight.remove(taskId);
        if (futures == null) {
            return 0;
        }
        int cancelled = 0;
        for (var future : futures) {
            if (future.cancel(true)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled {} in-flight provider calls for task {}", cancelled, taskId);
        }
        return cancelled;
    }

    /**
     * Forgets the task's in-flight bookkeeping once it has terminated.
     */
    public void release(String taskId) {
        var futures = inFlight.remove(taskId);
        if (futures != null && !futures.isEmpty()) {
            log.warn("Task {} released with {} provider calls still tracked", taskId, futures.size());
        }
    }

    /** True while provider bookkeeping is held for the task. */
    public boolean isTracking(String taskId) {
        return inFlight.containsKey(taskId);
    }

    private boolean waitExceeded(String taskId, PlanStep step, long elapsedMs) {
        long limitMs = properties.timeoutMillisFor(step.agentId());
        if (elapsedMs <= limitMs) {
            return false;
        }
        log.warn("Step {} [{}] of task {} waited {} ms in total, above the {} ms timeout", step.id(),
                step.agentId().wireName(), taskId, elapsedMs, limitMs);
        return true;
    }

    private AgentResponse invokeOnce(String taskId, AgentId agentId, TaskSnapshot snapshot, TaskContext context) {
        var provider = registry.get(agentId);
        long timeoutMs = properties.timeoutMillisFor(agentId);
        Future<AgentResponse> future = executor.submit(() -> provider.invoke(agentId, snapshot, context));
        var futures = inFlight.computeIfAbsent(taskId, k -> ConcurrentHashMap.newKeySet());
        futures.add(future);
        try {
            return validate(agentId, future.get(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderTimeoutException(agentId.wireName() + " did not respond within " + timeoutMs + " ms");
        } catch (CancellationException e) {
            throw new ProviderUnavailableException(agentId.wireName() + " call was cancelled");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException(agentId.wireName() + " call was interrupted", e);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof ProviderException pe) {
                throw pe;
            }
            throw new ProviderUnavailableException(agentId.wireName() + " failed: " + cause.getMessage(), cause);
        } finally {
            futures.remove(future);
        }
    }

    /**
     * @throws ProviderMalformedResponseException if the response is missing, answers for a different
     *         agent or carries a risk score outside 0..100
     */
    AgentResponse validate(AgentId expected, AgentResponse response) {
        if (response == null) {
            throw new ProviderMalformedResponseException(expected.wireName() + " returned no response");
        }
        if (response.agentId() != expected) {
            throw new ProviderMalformedResponseException("Expected a response from " + expected.wireName()
                    + " but got one from " + (response.agentId() == null ? "nobody" : response.agentId().wireName()));
        }
        if (response.riskScore() != null && (response.riskScore() < 0 || response.riskScore() > 100)) {
            throw new ProviderMalformedResponseException(expected.wireName()
                    + " returned risk score out of range: " + response.riskScore());
        }
        return response;
    }

    private boolean backoff() {
        try {
            Thread.sleep(properties.getRetryBackoffMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private ActionRecord failureRecord(PlanStep step, int attempt, Integer groupNumber,
                                       ProviderFailure failure, String error, long elapsedMs) {
        return new ActionRecord(step.id(), step.agentId(), step.action(), attempt, StepOutcome.FAILED,
                false, null, failure, error, groupNumber, elapsedMs, false, Instant.now());
    }

    private Map<String, Object> completedPayload(AgentId agentId, AgentResponse response) {
        var payload = new HashMap<String, Object>();
        payload.put("agent", agentId.wireName());
        if (response.riskScore() != null) {
            payload.put("riskScore", response.riskScore());
        }
        if (response.decision() != null) {
            payload.put("decision", response.decision().name());
        }
        return payload;
    }
}
