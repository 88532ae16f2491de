package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A single execution of a subtask by a worker. Append-only: never mutated after it is recorded.
 *
 * Invariants:
 * - attemptNumber >= 1 and contiguous per subtask
 * - completedAt is not before startedAt
 * - errorClassification is set on every recorded failure and null on success
 */
public record AgentAttempt(
    UUID attemptId,
    String subtaskId,
    int attemptNumber,
    Strategy strategy,
    Instant startedAt,
    Instant completedAt,
    AttemptOutcome outcome,
    FailureSignature errorClassification,
    String errorCode,
    String errorMessage,
    JsonNode payload,
    List<String> touchedTargets
) {
    public AgentAttempt {
        Objects.requireNonNull(subtaskId, "subtaskId");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(outcome, "outcome");
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }
        touchedTargets = touchedTargets != null ? List.copyOf(touchedTargets) : List.of();
    }

    public static AgentAttempt success(
            String subtaskId,
            int attemptNumber,
            Strategy strategy,
            Instant startedAt,
            Instant completedAt,
            JsonNode payload,
            List<String> touchedTargets) {
        return new AgentAttempt(UUID.randomUUID(), subtaskId, attemptNumber, strategy,
            startedAt, completedAt, AttemptOutcome.SUCCESS, null, null, null, payload, touchedTargets);
    }

    /**
     * A failed attempt, not yet classified. The pipeline tracker classifies it when recording.
     */
    public static AgentAttempt failure(
            String subtaskId,
            int attemptNumber,
            Strategy strategy,
            Instant startedAt,
            Instant completedAt,
            String errorCode,
            String errorMessage,
            JsonNode payload) {
        return new AgentAttempt(UUID.randomUUID(), subtaskId, attemptNumber, strategy,
            startedAt, completedAt, AttemptOutcome.FAILURE, null, errorCode, errorMessage, payload, List.of());
    }

    public AgentAttempt withClassification(FailureSignature signature) {
        return new AgentAttempt(attemptId, subtaskId, attemptNumber, strategy, startedAt, completedAt,
            outcome, signature, errorCode, errorMessage, payload, touchedTargets);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return outcome == AttemptOutcome.SUCCESS;
    }

    @JsonIgnore
    public boolean isFailure() {
        return outcome == AttemptOutcome.FAILURE;
    }

    public Duration duration() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }
}
