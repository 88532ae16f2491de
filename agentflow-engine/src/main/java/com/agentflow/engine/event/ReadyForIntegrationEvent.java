package com.agentflow.engine.event;

import java.time.Instant;
import java.util.List;

/**
 * Emitted when a task completes, carrying what the source-control integration needs to open
 * a change: the task and every target touched by a successful attempt.
 *
 * @param degradedSubtasks non-critical subtasks that failed; empty for a clean completion
 */
public record ReadyForIntegrationEvent(
    String taskId,
    String description,
    List<String> touchedTargets,
    List<String> degradedSubtasks,
    Instant completedAt
) {
    public ReadyForIntegrationEvent {
        touchedTargets = touchedTargets != null ? List.copyOf(touchedTargets) : List.of();
        degradedSubtasks = degradedSubtasks != null ? List.copyOf(degradedSubtasks) : List.of();
    }
}
