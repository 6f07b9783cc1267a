package com.socmind.provider;

import com.socmind.core.model.Task;

import java.io.Serializable;

/**
 * What a provider is told about the work it is asked to do.
 *
 * @param task      the task, immutable
 * @param stepId    plan step being executed ("triage" for the triage-first invocation)
 * @param action    action requested
 * @param rationale why the step is in the plan
 */
public record TaskSnapshot(
    Task task,
    String stepId,
    String action,
    String rationale
) implements Serializable {}
