package com.socmind.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.socmind.core.model.AuditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Audit sink that writes every record as JSON to the {@code socmind.audit} logger and keeps
 * it in memory for the API and CLI.
 */
@Service
public class AuditStore implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(AuditStore.class);
    private static final Logger auditLog = LoggerFactory.getLogger("socmind.audit");

    private final ConcurrentHashMap<String, AuditRecord> records = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public AuditStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void emit(AuditRecord record) {
        var previous = records.putIfAbsent(record.taskId(), record);
        if (previous != null) {
            log.warn("Audit record for task {} already emitted, ignoring duplicate", record.taskId());
            return;
        }
        auditLog.info(toJson(record));
    }

    public Optional<AuditRecord> find(String taskId) {
        return Optional.ofNullable(records.get(taskId));
    }

    public List<AuditRecord> all() {
        return List.copyOf(records.values());
    }

    public String toJson(AuditRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize audit record for task " + record.taskId(), e);
        }
    }
}
