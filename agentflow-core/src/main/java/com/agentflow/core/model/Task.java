package com.agentflow.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Root unit of work. Immutable once created.
 *
 * Invariants:
 * - taskId is non-blank and contains no ':' (subtask ids are derived from it)
 * - description is non-null
 * - declaredComplexity is null when the caller left classification to the orchestrator
 */
public record Task(
    String taskId,
    String description,
    ComplexityTier declaredComplexity,
    Instant createdAt
) {
    public Task {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    /**
     * Create a task, generating an id when the source did not supply a stable one.
     */
    public static Task create(String taskId, String description, ComplexityTier declaredComplexity, Instant now) {
        String id = taskId != null && !taskId.isBlank() ? taskId : UUID.randomUUID().toString();
        return new Task(id, description, declaredComplexity, now);
    }
}
