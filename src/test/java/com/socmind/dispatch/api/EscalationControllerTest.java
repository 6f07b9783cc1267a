package com.socmind.dispatch.api;

import com.socmind.core.escalation.PendingEscalationStore;
import com.socmind.core.model.EscalationEvent;
import com.socmind.core.model.EscalationReason;
import com.socmind.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(EscalationController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class EscalationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PendingEscalationStore pendingEscalations;

    @Test
    @DisplayName("GET /escalations lists pending escalations")
    void listsPending() throws Exception {
        when(pendingEscalations.pending()).thenReturn(List.of(
                new EscalationEvent("ESC-1", "SOC-2026-0001", EscalationReason.CRITICAL_CONTAINMENT, "S2",
                        Severity.CRITICAL, "Containment would act on Host 'DC-01' (domain-controller)",
                        Instant.parse("2026-01-01T00:00:00Z"))));

        mockMvc.perform(get("/api/v1/escalations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].taskId").value("SOC-2026-0001"))
                .andExpect(jsonPath("$[0].reason").value("CRITICAL_CONTAINMENT"));
    }

    @Test
    @DisplayName("GET /escalations returns an empty list when nothing is pending")
    void empty() throws Exception {
        when(pendingEscalations.pending()).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/escalations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }
}
