package com.socmind.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One provider invocation as recorded in the task context.
 *
 * @param stepId        plan step id ("triage" for the triage-first invocation)
 * @param agentId       provider invoked
 * @param action        action requested from the provider
 * @param attempt       1-based invocation attempt for this step
 * @param outcome       whether a usable response was received
 * @param partialGroup  true when another member of the same parallel group failed
 * @param response      the provider response; null on failure
 * @param failure       failure classification; null on success
 * @param error         failure detail; null on success
 * @param parallelGroup group number the step was dispatched in; nullable
 * @param elapsedMs     wall-clock time spent waiting on the provider, across retries and backoff
 * @param waitExceeded  true when {@code elapsedMs} went past the provider's configured timeout
 * @param recordedAt    when the engine committed the record
 */
public record ActionRecord(
    String stepId,
    AgentId agentId,
    String action,
    int attempt,
    StepOutcome outcome,
    boolean partialGroup,
    AgentResponse response,
    ProviderFailure failure,
    String error,
    Integer parallelGroup,
    long elapsedMs,
    boolean waitExceeded,
    Instant recordedAt
) implements Serializable {

    public boolean succeeded() {
        return outcome == StepOutcome.SUCCEEDED;
    }

    public ActionRecord withWaitExceeded() {
        return new ActionRecord(stepId, agentId, action, attempt, outcome, partialGroup, response,
                failure, error, parallelGroup, elapsedMs, true, recordedAt);
    }

    ActionRecord asPartialGroup() {
        return new ActionRecord(stepId, agentId, action, attempt, outcome, true, response,
                failure, error, parallelGroup, elapsedMs, waitExceeded, recordedAt);
    }
}
