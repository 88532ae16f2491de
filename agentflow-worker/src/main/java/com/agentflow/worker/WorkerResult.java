package com.agentflow.worker;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * What a worker returned for one attempt.
 *
 * @param payload raw result, opaque to the orchestrator
 * @param touchedTargets files or other targets the worker changed
 */
public record WorkerResult(
    boolean success,
    JsonNode payload,
    String errorCode,
    String error,
    List<String> touchedTargets
) {
    public WorkerResult {
        touchedTargets = touchedTargets != null ? List.copyOf(touchedTargets) : List.of();
    }

    public static WorkerResult success(JsonNode payload, List<String> touchedTargets) {
        return new WorkerResult(true, payload, null, null, touchedTargets);
    }

    public static WorkerResult failure(String errorCode, String error) {
        return new WorkerResult(false, null, errorCode, error, List.of());
    }

    public static WorkerResult failure(String errorCode, String error, JsonNode payload) {
        return new WorkerResult(false, payload, errorCode, error, List.of());
    }
}
