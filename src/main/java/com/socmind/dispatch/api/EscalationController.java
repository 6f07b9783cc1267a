package com.socmind.dispatch.api;

import com.socmind.core.escalation.PendingEscalationStore;
import com.socmind.core.model.EscalationEvent;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller listing escalations waiting for a reviewer.
 */
@RestController
@RequestMapping("/api/v1/escalations")
public class EscalationController {

    private final PendingEscalationStore pendingEscalations;

    public EscalationController(PendingEscalationStore pendingEscalations) {
        this.pendingEscalations = pendingEscalations;
    }

    /**
     * GET /api/v1/escalations — Pending escalations, oldest first.
     */
    @GetMapping
    public ResponseEntity<List<EscalationEvent>> pending() {
        return ResponseEntity.ok(pendingEscalations.pending());
    }
}
