package com.socmind.core.context;

import com.socmind.core.model.ActionRecord;
import com.socmind.core.model.AgentId;
import com.socmind.core.model.AgentResponse;
import com.socmind.core.model.StepOutcome;
import com.socmind.core.model.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Sole writer of {@link TaskContext}. Group results are committed as one unit and
 * supplied responses are recorded idempotently.
 */
@Service
public class ContextStore {

    private static final Logger log = LoggerFactory.getLogger(ContextStore.class);

    /**
     * Commits every record of a dispatched group at once. If any member failed, all
     * members are recorded as a partial group.
     */
    public TaskContext commitGroup(TaskContext context, List<ActionRecord> records) {
        var updated = context.appendAll(records);
        long failed = records.stream().filter(r -> !r.succeeded()).count();
        if (failed > 0 && records.size() > 1) {
            log.warn("Committed partial group of {} records ({} failed)", records.size(), failed);
        } else {
            log.debug("Committed {} records", records.size());
        }
        return updated;
    }

    /**
     * Records a response supplied from outside a dispatch (late or manually provided).
     * Resubmitting a response already recorded for the step returns {@code context} unchanged.
     */
    public TaskContext recordSupplied(TaskContext context, String stepId, AgentId agentId,
                                      String action, AgentResponse response) {
        if (context.hasRecorded(stepId, response)) {
            log.info("Response for step {} already recorded, ignoring resubmission", stepId);
            return context;
        }
        var record = new ActionRecord(stepId, agentId, action, context.attempts(stepId) + 1,
                StepOutcome.SUCCEEDED, false, response, null, null, null, 0L, false, Instant.now());
        return context.append(record);
    }
}
