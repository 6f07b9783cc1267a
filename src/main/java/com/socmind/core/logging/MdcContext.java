package com.socmind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing SocMind MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String TASK_ID = "taskId";
    public static final String STEP_ID = "stepId";
    public static final String AGENT_ID = "agentId";
    public static final String GROUP_NUMBER = "groupNumber";

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put(TASK_ID, taskId);
    }

    public static void setStep(String taskId, String stepId, String agentId) {
        MDC.put(TASK_ID, taskId);
        MDC.put(STEP_ID, stepId);
        MDC.put(AGENT_ID, agentId);
    }

    public static void setGroup(String taskId, int groupNumber) {
        MDC.put(TASK_ID, taskId);
        MDC.put(GROUP_NUMBER, String.valueOf(groupNumber));
    }

    /** Removes step-level keys, keeping the task and group. */
    public static void clearStep() {
        MDC.remove(STEP_ID);
        MDC.remove(AGENT_ID);
    }

    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(STEP_ID);
        MDC.remove(AGENT_ID);
        MDC.remove(GROUP_NUMBER);
    }
}
