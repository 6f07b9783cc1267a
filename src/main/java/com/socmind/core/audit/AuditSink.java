package com.socmind.core.audit;

import com.socmind.core.model.AuditRecord;

/**
 * Receives one immutable audit record per terminal task.
 */
public interface AuditSink {

    void emit(AuditRecord record);
}
