package com.socmind.core.engine;

import com.socmind.core.model.Task;
import com.socmind.core.model.TaskNotFoundException;
import com.socmind.core.model.TaskStatus;
import com.socmind.core.state.TaskState;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory index of every task the engine has accepted, with its live status and the
 * state its last graph run ended in.
 */
@Service
public class TaskRegistry {

    private final ConcurrentHashMap<String, TrackedTask> tasks = new ConcurrentHashMap<>();

    public TrackedTask register(Task task) {
        var tracked = new TrackedTask(task, Instant.now());
        if (tasks.putIfAbsent(task.id(), tracked) != null) {
            throw new IllegalStateException("Task " + task.id() + " is already registered");
        }
        return tracked;
    }

    /**
     * @throws TaskNotFoundException if no task has that id
     */
    public TrackedTask get(String taskId) {
        var tracked = tasks.get(taskId);
        if (tracked == null) {
            throw new TaskNotFoundException(taskId);
        }
        return tracked;
    }

    public Optional<TrackedTask> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public List<TrackedTask> all() {
        return tasks.values().stream()
                .sorted(Comparator.comparing(TrackedTask::receivedAt))
                .toList();
    }

    public long count(TaskStatus status) {
        return tasks.values().stream().filter(t -> t.status() == status).count();
    }

    public Collection<TrackedTask> values() {
        return tasks.values();
    }

    /**
     * A task known to the engine. The status follows the graph as it runs; the state is the
     * one the latest run finished with.
     */
    public static final class TrackedTask {

        private final Task task;
        private final Instant receivedAt;
        private volatile TaskStatus status = TaskStatus.RECEIVED;
        private volatile TaskState state;
        private volatile CompletableFuture<TaskState> currentRun = CompletableFuture.completedFuture(null);
        private final AtomicInteger runs = new AtomicInteger();

        TrackedTask(Task task, Instant receivedAt) {
            this.task = task;
            this.receivedAt = receivedAt;
        }

        public Task task() { return task; }
        public Instant receivedAt() { return receivedAt; }
        public TaskStatus status() { return status; }
        public Optional<TaskState> state() { return Optional.ofNullable(state); }
        public CompletableFuture<TaskState> currentRun() { return currentRun; }

        public boolean isRunning() {
            return !currentRun.isDone();
        }

        void updateStatus(TaskStatus status) { this.status = status; }

        void finishRun(TaskState state) {
            this.state = state;
            this.status = state.status();
        }

        void startRun(CompletableFuture<TaskState> run) { this.currentRun = run; }

        int nextRunNumber() { return runs.incrementAndGet(); }
    }
}
