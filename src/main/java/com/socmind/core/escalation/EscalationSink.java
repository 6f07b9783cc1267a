package com.socmind.core.escalation;

import com.socmind.core.model.EscalationEvent;
import com.socmind.core.model.HumanDecision;

/**
 * Receives escalations that need a human decision, and learns when they are settled.
 */
public interface EscalationSink {

    void raise(EscalationEvent event);

    void resolved(String taskId, HumanDecision decision);
}
