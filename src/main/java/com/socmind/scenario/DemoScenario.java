package com.socmind.scenario;

import com.socmind.core.model.TaskStatus;
import com.socmind.core.model.TaskSubmission;

/**
 * A built-in task with the status it reaches against simulated providers.
 *
 * @param name           short name used on the command line
 * @param description    what the scenario demonstrates
 * @param submission     the task to run
 * @param expectedStatus status the run ends in
 */
public record DemoScenario(
    String name,
    String description,
    TaskSubmission submission,
    TaskStatus expectedStatus
) {}
