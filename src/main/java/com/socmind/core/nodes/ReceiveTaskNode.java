package com.socmind.core.nodes;

import com.socmind.core.events.EventBus;
import com.socmind.core.events.SocmindEvent;
import com.socmind.core.model.TaskStatus;
import com.socmind.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Entry node. Moves a freshly received task into the triage-first check; on a resumed
 * run it changes nothing and only lets the graph route from the stored status.
 */
@Component
public class ReceiveTaskNode {

    private static final Logger log = LoggerFactory.getLogger(ReceiveTaskNode.class);

    private final EventBus eventBus;

    public ReceiveTaskNode(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(TaskState state) {
        if (state.status() != TaskStatus.RECEIVED) {
            log.info("Resuming task {} from {}", state.taskId(), state.status());
            return Map.of();
        }
        var task = state.task();
        log.info("Received {} task {}: {}", task.taskType().wireName(), task.id(), task.description());
        eventBus.publish(SocmindEvent.of("task.received", task.id(), null,
                Map.of("taskType", task.taskType().wireName(),
                       "triageFirst", task.requiresTriageFirst())));
        eventBus.publish(SocmindEvent.status(task.id(), TaskStatus.TRIAGE_CHECK));
        return Map.of(TaskState.STATUS, TaskStatus.TRIAGE_CHECK.name());
    }
}
