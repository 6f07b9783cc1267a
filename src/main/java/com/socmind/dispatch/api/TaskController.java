package com.socmind.dispatch.api;

import com.socmind.core.audit.AuditStore;
import com.socmind.core.engine.OrchestrationEngine;
import com.socmind.core.engine.TaskRegistry;
import com.socmind.core.model.AuditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the task lifecycle: submission, inspection, human decisions and
 * supplied responses.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final OrchestrationEngine engine;
    private final TaskRegistry registry;
    private final AuditStore auditStore;
    private final SseStreamingService sseStreamingService;

    public TaskController(OrchestrationEngine engine,
                          TaskRegistry registry,
                          AuditStore auditStore,
                          SseStreamingService sseStreamingService) {
        this.engine = engine;
        this.registry = registry;
        this.auditStore = auditStore;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/tasks — Submit a task. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submitTask(@RequestBody TaskRequest request) {
        String taskId = engine.submit(request.toSubmission());
        log.info("Accepted task {} ({})", taskId, request.taskType());
        return ResponseEntity.accepted().body(Map.of(
                "task_id", taskId,
                "status", registry.get(taskId).status().name()
        ));
    }

    /**
     * GET /api/v1/tasks — List all tracked tasks, oldest first.
     */
    @GetMapping
    public ResponseEntity<List<TaskResponse>> listTasks() {
        return ResponseEntity.ok(registry.all().stream().map(TaskResponse::from).toList());
    }

    /**
     * GET /api/v1/tasks/{id} — Task status with per-step progress.
     */
    @GetMapping("/{id}")
    public ResponseEntity<TaskResponse> getTask(@PathVariable String id) {
        return ResponseEntity.ok(TaskResponse.from(registry.get(id)));
    }

    /**
     * GET /api/v1/tasks/{id}/audit — The audit record, once the task has terminated.
     */
    @GetMapping("/{id}/audit")
    public ResponseEntity<AuditRecord> getAudit(@PathVariable String id) {
        registry.get(id);
        return auditStore.find(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/tasks/{id}/events — SSE stream of task events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        registry.get(id);
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    /**
     * POST /api/v1/tasks/{id}/decision — Resolve the pending escalation and resume.
     */
    @PostMapping("/{id}/decision")
    public ResponseEntity<Map<String, String>> decide(@PathVariable String id,
                                                      @RequestBody DecisionRequest request) {
        var decision = request.toDecision();
        engine.resolve(id, decision);
        return ResponseEntity.accepted().body(Map.of(
                "task_id", id,
                "decision", decision.type().name(),
                "status", registry.get(id).status().name()
        ));
    }

    /**
     * POST /api/v1/tasks/{id}/steps/{stepId}/response — Supply a response for a step of a
     * task awaiting information.
     */
    @PostMapping("/{id}/steps/{stepId}/response")
    public ResponseEntity<Map<String, String>> supplyResponse(@PathVariable String id,
                                                              @PathVariable String stepId,
                                                              @RequestBody SupplyResponseRequest request) {
        engine.supplyResponse(id, stepId, request.toResponse());
        return ResponseEntity.accepted().body(Map.of(
                "task_id", id,
                "step_id", stepId,
                "status", registry.get(id).status().name()
        ));
    }
}
