package com.socmind.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.socmind.core.model.ActionRecord;
import com.socmind.core.model.AgentDecision;
import com.socmind.core.model.AgentId;
import com.socmind.core.model.AgentResponse;
import com.socmind.core.model.Alert;
import com.socmind.core.model.Entity;
import com.socmind.core.model.Priority;
import com.socmind.core.model.Severity;
import com.socmind.core.model.StepOutcome;
import com.socmind.core.model.Task;
import com.socmind.core.model.TaskContext;
import com.socmind.core.model.TaskType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class HttpCapabilityProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private HttpClient httpClient;
    private HttpCapabilityProvider provider;

    private static final Task TASK = new Task("SOC-2026-0001", TaskType.ALERT_ANALYSIS, "check it",
            new Alert("A-7", "Impossible travel", Severity.HIGH, "two countries", Set.of("InitialAccess"),
                    Set.of("T1078"), List.of(new Entity("Account", "ana@corp", null))),
            TaskContext.withRelatedIncidents(Set.of("INC-1")));
    private static final TaskSnapshot SNAPSHOT = new TaskSnapshot(TASK, "triage", "triage", "first look");

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        provider = new HttpCapabilityProvider(AgentId.TRIAGE, URI.create("http://triage.local/invoke"),
                objectMapper, httpClient, Duration.ofSeconds(5));
    }

    // ===================================================================
    // Response parsing
    // ===================================================================

    @Nested
    @DisplayName("parseResponse")
    class ParseResponse {

        @Test
        @DisplayName("Reads every field of a full response")
        void full() {
            var response = provider.parseResponse("""
                    {"agent_id":"triage","findings":"Credential theft","risk_score":88,
                     "priority":"P2","decision":"ESCALATE","correlated_alert_ids":["A-9","A-10"]}
                    """);

            assertEquals(AgentId.TRIAGE, response.agentId());
            assertEquals("Credential theft", response.findings());
            assertEquals(88, response.riskScore());
            assertEquals(Priority.P2, response.priority());
            assertEquals(AgentDecision.ESCALATE, response.decision());
            assertEquals(Set.of("A-9", "A-10"), response.correlatedAlertIds());
        }

        @Test
        @DisplayName("Optional fields may be missing or null")
        void sparse() {
            var response = provider.parseResponse("{\"agent_id\":\"hunting-agent\",\"risk_score\":null}");

            assertEquals(AgentId.HUNTING, response.agentId());
            assertNull(response.findings());
            assertNull(response.riskScore());
            assertNull(response.decision());
            assertTrue(response.correlatedAlertIds().isEmpty());
        }

        @Test
        @DisplayName("Invalid JSON is malformed")
        void invalidJson() {
            assertThrows(ProviderMalformedResponseException.class, () -> provider.parseResponse("{not json"));
        }

        @Test
        @DisplayName("A non-numeric risk score is malformed")
        void nonNumericScore() {
            assertThrows(ProviderMalformedResponseException.class,
                    () -> provider.parseResponse("{\"agent_id\":\"triage\",\"risk_score\":\"high\"}"));
        }

        @Test
        @DisplayName("A risk score too large for an int is malformed, not truncated")
        void oversizedScore() {
            var error = assertThrows(ProviderMalformedResponseException.class,
                    () -> provider.parseResponse("{\"agent_id\":\"triage\",\"risk_score\":4294967346}"));
            assertTrue(error.getMessage().contains("4294967346"), error.getMessage());
            assertThrows(ProviderMalformedResponseException.class, () -> provider.parseResponse(
                    "{\"agent_id\":\"triage\",\"risk_score\":123456789012345678901234567890}"));
        }

        @Test
        @DisplayName("An unknown decision is malformed")
        void unknownDecision() {
            assertThrows(ProviderMalformedResponseException.class,
                    () -> provider.parseResponse("{\"agent_id\":\"triage\",\"decision\":\"PANIC\"}"));
        }

        @Test
        @DisplayName("A response without agent_id is malformed")
        void noAgent() {
            assertThrows(ProviderMalformedResponseException.class,
                    () -> provider.parseResponse("{\"findings\":\"x\"}"));
        }
    }

    @Test
    @DisplayName("The request carries the task, the step and committed history only")
    void requestBody() throws Exception {
        var committed = new ActionRecord("S1", AgentId.INTEL, "enrich", 1, StepOutcome.SUCCEEDED, false,
                new AgentResponse(AgentId.INTEL, "Known infra", 40, null, AgentDecision.MONITOR, Set.of()),
                null, null, 1, 5L, false, Instant.now());
        var failed = new ActionRecord("S2", AgentId.HUNTING, "hunt", 1, StepOutcome.FAILED, false, null,
                null, "down", 1, 5L, false, Instant.now());
        var context = TASK.context().append(committed).append(failed);

        var root = objectMapper.readTree(provider.buildRequestBody(AgentId.TRIAGE, SNAPSHOT, context));

        assertEquals("triage", root.get("agent_id").asText());
        assertEquals("SOC-2026-0001", root.path("task").path("id").asText());
        assertEquals("alert_analysis", root.path("task").path("task_type").asText());
        assertEquals("HIGH", root.path("task").path("alert").path("severity").asText());
        assertFalse(root.path("task").path("alert").path("entities").get(0).has("category"));
        assertEquals("first look", root.path("step").path("rationale").asText());
        assertEquals(1, root.path("context").path("previous_actions").size());
        assertEquals("MONITOR", root.path("context").path("previous_actions").get(0).path("decision").asText());
        assertEquals("INC-1", root.path("context").path("related_incidents").get(0).asText());
    }

    // ===================================================================
    // Transport
    // ===================================================================

    @Nested
    @DisplayName("invoke")
    class Invoke {

        @Test
        @DisplayName("A 200 answer is parsed")
        @SuppressWarnings("unchecked")
        void ok() throws Exception {
            HttpResponse<String> response = mock(HttpResponse.class);
            when(response.statusCode()).thenReturn(200);
            when(response.body()).thenReturn("{\"agent_id\":\"triage\",\"risk_score\":70}");
            doReturn(response).when(httpClient).send(any(), any());

            assertEquals(70, provider.invoke(AgentId.TRIAGE, SNAPSHOT, TaskContext.empty()).riskScore());
        }

        @Test
        @DisplayName("A gateway timeout is a provider timeout")
        @SuppressWarnings("unchecked")
        void gatewayTimeout() throws Exception {
            HttpResponse<String> response = mock(HttpResponse.class);
            when(response.statusCode()).thenReturn(504);
            doReturn(response).when(httpClient).send(any(), any());

            assertThrows(ProviderTimeoutException.class,
                    () -> provider.invoke(AgentId.TRIAGE, SNAPSHOT, TaskContext.empty()));
        }

        @Test
        @DisplayName("Server errors mean the provider is unavailable")
        @SuppressWarnings("unchecked")
        void serverError() throws Exception {
            HttpResponse<String> response = mock(HttpResponse.class);
            when(response.statusCode()).thenReturn(503);
            when(response.body()).thenReturn("maintenance");
            doReturn(response).when(httpClient).send(any(), any());

            assertThrows(ProviderUnavailableException.class,
                    () -> provider.invoke(AgentId.TRIAGE, SNAPSHOT, TaskContext.empty()));
        }

        @Test
        @DisplayName("Client-side timeouts and refused connections are classified")
        void transportFailures() throws Exception {
            doThrow(new HttpTimeoutException("slow")).when(httpClient).send(any(), any());
            assertThrows(ProviderTimeoutException.class,
                    () -> provider.invoke(AgentId.TRIAGE, SNAPSHOT, TaskContext.empty()));

            doThrow(new ConnectException("refused")).when(httpClient).send(any(), any());
            assertThrows(ProviderUnavailableException.class,
                    () -> provider.invoke(AgentId.TRIAGE, SNAPSHOT, TaskContext.empty()));
        }
    }
}
