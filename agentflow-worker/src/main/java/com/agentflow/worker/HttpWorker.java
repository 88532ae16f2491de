package com.agentflow.worker;

import com.agentflow.core.model.AgentAttempt;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Worker backed by a remote agent service speaking JSON over HTTP.
 *
 * Request body:
 * <pre>
 * {"subtaskId": "...", "taskId": "...", "description": "...", "capability": "implementation",
 *  "targets": ["src/app.py"], "strategy": "mechanical-fix", "attemptNumber": 2,
 *  "idempotencyKey": "...", "priorAttempts": [{"attemptNumber": 1, "strategy": "direct", ...}]}
 * </pre>
 * Response body: {@code {"success": true, "payload": {...}, "errorCode": null, "error": null,
 * "touchedTargets": ["src/app.py"]}}
 *
 * 5xx, 429 and I/O errors are retryable; other non-2xx statuses are permanent.
 */
public class HttpWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(HttpWorker.class);

    private final URI endpoint;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpWorker(URI endpoint, ObjectMapper objectMapper, Duration requestTimeout) {
        this.endpoint = endpoint;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    @Override
    public WorkerResult execute(WorkerRequest request) throws WorkerException {
        String body;
        try {
            body = objectMapper.writeValueAsString(toRequestBody(request));
        } catch (IOException e) {
            throw new WorkerException("SERIALIZATION_ERROR", "Could not encode request: " + e.getMessage(), e, false);
        }

        HttpRequest httpRequest = HttpRequest.newBuilder()
            .uri(endpoint)
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .header("Idempotency-Key", request.getIdempotencyKey())
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new WorkerException("WORKER_UNREACHABLE", "Worker call to " + endpoint + " failed: " + e.getMessage(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerException("INTERRUPTED", "Worker call interrupted", e, true);
        }

        int status = response.statusCode();
        if (status >= 500 || status == 429) {
            log.warn("Worker {} returned {} for {}", endpoint, status, request.getSubtaskId());
            throw WorkerException.retryable("WORKER_HTTP_" + status, truncate(response.body()));
        }
        if (status < 200 || status >= 300) {
            throw WorkerException.permanent("WORKER_HTTP_" + status, truncate(response.body()));
        }
        return parseResult(response.body());
    }

    private ObjectNode toRequestBody(WorkerRequest request) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("subtaskId", request.getSubtaskId());
        node.put("taskId", request.getTaskId());
        node.put("description", request.getDescription());
        node.put("capability", request.getCapability());
        ArrayNode targets = node.putArray("targets");
        request.getTargets().forEach(targets::add);
        node.put("strategy", request.getStrategy().value());
        node.put("attemptNumber", request.getAttemptNumber());
        node.put("idempotencyKey", request.getIdempotencyKey());
        ArrayNode prior = node.putArray("priorAttempts");
        for (AgentAttempt attempt : request.getPriorAttempts()) {
            ObjectNode entry = prior.addObject();
            entry.put("attemptNumber", attempt.attemptNumber());
            entry.put("strategy", attempt.strategy().value());
            entry.put("outcome", attempt.outcome().name());
            if (attempt.errorClassification() != null) {
                entry.put("errorClassification", attempt.errorClassification().value());
            }
            if (attempt.errorMessage() != null) {
                entry.put("errorMessage", attempt.errorMessage());
            }
        }
        return node;
    }

    private WorkerResult parseResult(String body) throws WorkerException {
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new WorkerException("MALFORMED_RESPONSE", "Unreadable worker response: " + e.getMessage(), e, true);
        }
        if (node == null || !node.has("success")) {
            throw WorkerException.retryable("MALFORMED_RESPONSE", "Worker response has no 'success' field");
        }

        List<String> touched = new ArrayList<>();
        node.path("touchedTargets").forEach(t -> touched.add(t.asText()));
        JsonNode payload = node.hasNonNull("payload") ? node.get("payload") : null;

        if (node.get("success").asBoolean()) {
            return WorkerResult.success(payload, touched);
        }
        return WorkerResult.failure(
            node.hasNonNull("errorCode") ? node.get("errorCode").asText() : null,
            node.hasNonNull("error") ? node.get("error").asText() : "worker reported failure",
            payload);
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
