package com.socmind.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.socmind.core.model.ActionRecord;
import com.socmind.core.model.AgentDecision;
import com.socmind.core.model.AgentId;
import com.socmind.core.model.AgentResponse;
import com.socmind.core.model.Alert;
import com.socmind.core.model.Priority;
import com.socmind.core.model.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Capability provider reached over HTTP. Each agent has its own endpoint that accepts a
 * JSON invocation and answers with a JSON {@link AgentResponse}.
 * <p>
 * Request body:
 * <pre>
 * { "agent_id": "triage",
 *   "task": { "id", "task_type", "description", "alert": {...} },
 *   "step": { "id", "action", "rationale" },
 *   "context": { "previous_actions": [...], "related_incidents": [...], "correlated_alert_ids": [...] } }
 * </pre>
 * Response body: {@code agent_id, findings, risk_score, priority, decision, correlated_alert_ids}.
 */
public class HttpCapabilityProvider implements CapabilityProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpCapabilityProvider.class);

    private final AgentId agentId;
    private final URI endpoint;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpCapabilityProvider(AgentId agentId, URI endpoint, ObjectMapper objectMapper,
                                  Duration connectTimeout, Duration requestTimeout) {
        this(agentId, endpoint, objectMapper, HttpClient.newBuilder().connectTimeout(connectTimeout).build(),
                requestTimeout);
    }

    HttpCapabilityProvider(AgentId agentId, URI endpoint, ObjectMapper objectMapper,
                           HttpClient httpClient, Duration requestTimeout) {
        this.agentId = agentId;
        this.endpoint = endpoint;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public AgentId agentId() {
        return agentId;
    }

    @Override
    public AgentResponse invoke(AgentId requested, TaskSnapshot snapshot, TaskContext context) {
        String body = buildRequestBody(requested, snapshot, context);
        var request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderTimeoutException(requested.wireName() + " timed out at " + endpoint, e);
        } catch (ConnectException e) {
            throw new ProviderUnavailableException(requested.wireName() + " unreachable at " + endpoint, e);
        } catch (IOException e) {
            throw new ProviderUnavailableException(requested.wireName() + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException(requested.wireName() + " request interrupted", e);
        }

        int status = response.statusCode();
        if (status == 408 || status == 504) {
            throw new ProviderTimeoutException("%s returned HTTP %d".formatted(requested.wireName(), status));
        }
        if (status >= 400) {
            throw new ProviderUnavailableException("%s returned HTTP %d: %s"
                    .formatted(requested.wireName(), status, abbreviate(response.body())));
        }
        log.debug("{} answered step {} with HTTP {}", requested.wireName(), snapshot.stepId(), status);
        return parseResponse(response.body());
    }

    /**
     * Parses a provider response body.
     *
     * @throws ProviderMalformedResponseException if the body is not a response object
     */
    AgentResponse parseResponse(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new ProviderMalformedResponseException("Response is not a JSON object: " + abbreviate(body));
            }
            var responder = text(root, "agent_id");
            if (responder == null) {
                throw new ProviderMalformedResponseException("Response has no agent_id");
            }
            var correlated = new LinkedHashSet<String>();
            var ids = root.get("correlated_alert_ids");
            if (ids != null && ids.isArray()) {
                ids.forEach(n -> correlated.add(n.asText()));
            }
            var score = root.get("risk_score");
            if (score != null && !score.isNull() && !score.isIntegralNumber()) {
                throw new ProviderMalformedResponseException("risk_score is not an integer: " + score);
            }
            if (score != null && !score.isNull() && !score.canConvertToInt()) {
                throw new ProviderMalformedResponseException("risk_score does not fit an int: " + score);
            }
            var priority = text(root, "priority");
            var decision = text(root, "decision");
            return new AgentResponse(
                    AgentId.fromWire(responder),
                    text(root, "findings"),
                    score == null || score.isNull() ? null : score.intValue(),
                    priority == null ? null : Priority.fromWire(priority),
                    decision == null ? null : AgentDecision.fromWire(decision),
                    correlated);
        } catch (JsonProcessingException e) {
            throw new ProviderMalformedResponseException("Response is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ProviderMalformedResponseException("Response has an unknown value: " + e.getMessage(), e);
        }
    }

    String buildRequestBody(AgentId requested, TaskSnapshot snapshot, TaskContext context) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("agent_id", requested.wireName());

        var task = snapshot.task();
        ObjectNode taskNode = root.putObject("task");
        taskNode.put("id", task.id());
        taskNode.put("task_type", task.taskType().wireName());
        taskNode.put("description", task.description());
        if (task.alert() != null) {
            writeAlert(taskNode.putObject("alert"), task.alert());
        }

        ObjectNode step = root.putObject("step");
        step.put("id", snapshot.stepId());
        step.put("action", snapshot.action());
        step.put("rationale", snapshot.rationale());

        ObjectNode ctx = root.putObject("context");
        ArrayNode actions = ctx.putArray("previous_actions");
        for (ActionRecord record : context.committedActions()) {
            ObjectNode node = actions.addObject();
            node.put("step_id", record.stepId());
            node.put("agent_id", record.agentId().wireName());
            node.put("action", record.action());
            var r = record.response();
            node.put("findings", r.findings());
            if (r.riskScore() != null) {
                node.put("risk_score", r.riskScore());
            }
            if (r.decision() != null) {
                node.put("decision", r.decision().name());
            }
        }
        writeStrings(ctx.putArray("related_incidents"), context.relatedIncidents());
        writeStrings(ctx.putArray("correlated_alert_ids"), context.correlatedAlertIds());
        return root.toString();
    }

    private void writeAlert(ObjectNode node, Alert alert) {
        node.put("alert_id", alert.alertId());
        node.put("name", alert.name());
        node.put("severity", alert.severity() == null ? null : alert.severity().name());
        node.put("description", alert.description());
        writeStrings(node.putArray("tactics"), alert.tactics());
        writeStrings(node.putArray("techniques"), alert.techniques());
        ArrayNode entities = node.putArray("entities");
        for (var entity : alert.entities()) {
            ObjectNode e = entities.addObject();
            e.put("type", entity.type());
            e.put("name", entity.name());
            if (entity.category() != null) {
                e.put("category", entity.category());
            }
        }
    }

    private static void writeStrings(ArrayNode array, Set<String> values) {
        values.stream().sorted().forEach(array::add);
    }

    private static String text(JsonNode root, String field) {
        var node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
