package com.socmind.dispatch.api;

import com.socmind.core.events.EventBus;
import com.socmind.core.events.SocmindEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Streams a task's {@link EventBus} events to an {@link SseEmitter}.
 * <p>
 * The stream completes after the task's {@code task.completed} event. A task that halts
 * keeps its stream open so the reviewer sees the escalation and the resumed run.
 * Heartbeat comments are sent periodically to keep idle connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes (a halted task may wait on a reviewer). */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    static final String TASK_COMPLETED = "task.completed";

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdownNow();
    }

    /**
     * Creates an emitter subscribed to the task's events.
     */
    public SseEmitter createEmitter(String taskId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBus.Subscription subscription = eventBus.subscribe(taskId, event -> forward(emitter, event));
        var registration = new EmitterRegistration(taskId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for task {}", taskId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for task {}: {}", taskId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for task {}: {}", taskId, e.getMessage());
        }
        log.info("SSE emitter created for task {} (timeout={}ms)", taskId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void forward(SseEmitter emitter, SocmindEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(toData(event)));
            if (TASK_COMPLETED.equals(event.eventType())) {
                emitter.complete();
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for task {}: {}",
                    event.eventType(), event.taskId(), e.getMessage());
        }
    }

    static Map<String, Object> toData(SocmindEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("taskId", event.taskId());
        if (event.stepId() != null) {
            data.put("stepId", event.stepId());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat failed for task {}: {}", registration.taskId(), e.getMessage());
            }
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription().unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            String taskId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
