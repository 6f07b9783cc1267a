package com.socmind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for task lifecycle events.
 * <p>
 * Events are published from graph nodes and provider threads alike. A task's own
 * subscribers see each event before the global ones, so an SSE stream never lags the
 * engine's status tracking. Subscriptions for a task are released when it is archived.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, List<Consumer<SocmindEvent>>> byTask = new ConcurrentHashMap<>();
    private final List<Consumer<SocmindEvent>> global = new CopyOnWriteArrayList<>();

    public void publish(SocmindEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("Event {} for task {}{}", event.eventType(), event.taskId(),
                    event.stepId() == null ? "" : " step " + event.stepId());
        }
        var taskSubscribers = byTask.get(event.taskId());
        if (taskSubscribers != null) {
            taskSubscribers.forEach(subscriber -> deliver(subscriber, event));
        }
        global.forEach(subscriber -> deliver(subscriber, event));
    }

    /**
     * Subscribes to the events of one task.
     */
    public Subscription subscribe(String taskId, Consumer<SocmindEvent> consumer) {
        byTask.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to task {}", taskId);
        return () -> byTask.computeIfPresent(taskId, (k, subscribers) -> {
            subscribers.remove(consumer);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }

    public Subscription subscribeAll(Consumer<SocmindEvent> consumer) {
        global.add(consumer);
        return () -> global.remove(consumer);
    }

    /**
     * Drops every subscription held for an archived task.
     *
     * @return number of subscriptions dropped
     */
    public int release(String taskId) {
        var removed = byTask.remove(taskId);
        int count = removed == null ? 0 : removed.size();
        if (count > 0) {
            log.debug("Released {} subscription(s) for task {}", count, taskId);
        }
        return count;
    }

    public int subscriberCount(String taskId) {
        var subscribers = byTask.get(taskId);
        return subscribers == null ? 0 : subscribers.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(Consumer<SocmindEvent> subscriber, SocmindEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {} for task {}: {}", event.eventType(), event.taskId(),
                    e.getMessage(), e);
        }
    }
}
