package com.agentflow.worker;

import com.agentflow.core.model.AgentAttempt;
import com.agentflow.core.model.FailureSignature;
import com.agentflow.core.model.Strategy;
import com.agentflow.core.model.Subtask;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class HttpWorkerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<String> lastRequest = new AtomicReference<>();
    private final AtomicReference<Integer> nextStatus = new AtomicReference<>(200);
    private final AtomicReference<String> nextBody = new AtomicReference<>("{}");

    private HttpServer server;
    private HttpWorker worker;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/execute", exchange -> {
            lastRequest.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] body = nextBody.get().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(nextStatus.get(), body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        URI endpoint = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/execute");
        worker = new HttpWorker(endpoint, objectMapper, Duration.ofSeconds(5));
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    @DisplayName("Sends strategy and prior attempts, maps a successful reply")
    void successfulCall() throws Exception {
        nextBody.set("{\"success\":true,\"payload\":{\"diff\":\"+x\"},\"touchedTargets\":[\"README.md\"]}");

        WorkerResult result = worker.execute(request());

        assertThat(result.success()).isTrue();
        assertThat(result.payload().get("diff").asText()).isEqualTo("+x");
        assertThat(result.touchedTargets()).containsExactly("README.md");

        JsonNode sent = objectMapper.readTree(lastRequest.get());
        assertThat(sent.get("strategy").asText()).isEqualTo("mechanical-fix");
        assertThat(sent.get("attemptNumber").asInt()).isEqualTo(2);
        assertThat(sent.get("idempotencyKey").asText()).isEqualTo("t1:impl:2");
        assertThat(sent.get("priorAttempts").get(0).get("errorClassification").asText()).isEqualTo("syntax-error");
    }

    @Test
    @DisplayName("Maps a failure reply to a failed result")
    void failureReply() throws Exception {
        nextBody.set("{\"success\":false,\"errorCode\":\"SYNTAX\",\"error\":\"unexpected token\"}");

        WorkerResult result = worker.execute(request());

        assertThat(result.success()).isFalse();
        assertThat(result.errorCode()).isEqualTo("SYNTAX");
        assertThat(result.error()).isEqualTo("unexpected token");
    }

    @Test
    @DisplayName("5xx is retryable, 4xx is permanent")
    void statusMapping() {
        nextStatus.set(503);
        nextBody.set("overloaded");
        assertThatThrownBy(() -> worker.execute(request()))
            .isInstanceOfSatisfying(WorkerException.class, e -> {
                assertThat(e.isRetryable()).isTrue();
                assertThat(e.getErrorCode()).isEqualTo("WORKER_HTTP_503");
            });

        nextStatus.set(400);
        nextBody.set("bad request");
        assertThatThrownBy(() -> worker.execute(request()))
            .isInstanceOfSatisfying(WorkerException.class, e -> assertThat(e.isRetryable()).isFalse());
    }

    @Test
    @DisplayName("Reply without a success flag is rejected as malformed")
    void malformedReply() {
        nextBody.set("{\"payload\":{}}");

        assertThatThrownBy(() -> worker.execute(request()))
            .isInstanceOfSatisfying(WorkerException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo("MALFORMED_RESPONSE"));
    }

    private static WorkerRequest request() {
        Subtask subtask = Subtask.pending("t1", "impl", "fix the parser", Subtask.CAPABILITY_IMPLEMENTATION,
            List.of(), List.of("parser.py"));
        Instant now = Instant.now();
        AgentAttempt prior = AgentAttempt.failure("t1:impl", 1, Strategy.DIRECT, now, now, "SYNTAX", "syntax error", null)
            .withClassification(FailureSignature.SYNTAX_ERROR);
        return new WorkerRequest(subtask, Strategy.MECHANICAL_FIX, 2, List.of(prior));
    }
}
