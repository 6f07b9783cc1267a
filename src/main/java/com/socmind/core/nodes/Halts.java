package com.socmind.core.nodes;

import com.socmind.core.events.EventBus;
import com.socmind.core.events.SocmindEvent;
import com.socmind.core.model.EscalationEvent;
import com.socmind.core.model.TaskStatus;
import com.socmind.core.state.TaskState;

import java.util.ArrayList;
import java.util.Map;

/**
 * Shared state updates for nodes that stop dispatch on an escalation.
 */
final class Halts {

    private Halts() {}

    /**
     * Adds the updates that halt the task in {@code status} (Escalated or AwaitingInformation)
     * with {@code escalation} pending.
     */
    static Map<String, Object> halt(TaskState state, Map<String, Object> updates, EscalationEvent escalation,
                                    TaskStatus status, EventBus eventBus) {
        var escalations = new ArrayList<>(state.escalations());
        escalations.add(escalation);
        updates.put(TaskState.STATUS, status.name());
        updates.put(TaskState.ESCALATION, escalation);
        updates.put(TaskState.ESCALATIONS, escalations);
        eventBus.publish(SocmindEvent.status(state.taskId(), status));
        return updates;
    }
}
