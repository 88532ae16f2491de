package com.agentflow.core.model;

import com.agentflow.core.exception.InvalidStateTransitionException;

import java.util.List;
import java.util.Objects;

/**
 * One node of a Task's dependency graph, dispatched to exactly one worker per attempt.
 *
 * Invariants:
 * - subtaskId is "{taskId}:{suffix}"
 * - a subtask may only enter RUNNING when every id in dependsOn is SUCCEEDED
 */
public record Subtask(
    String subtaskId,
    String taskId,
    String description,
    String capability,
    List<String> dependsOn,
    List<String> targets,
    SubtaskStatus status
) {
    // Capability tags produced by decomposition
    public static final String CAPABILITY_PLANNING = "planning";
    public static final String CAPABILITY_IMPLEMENTATION = "implementation";
    public static final String CAPABILITY_VALIDATION = "validation";

    public Subtask {
        Objects.requireNonNull(subtaskId, "subtaskId");
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(capability, "capability");
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        targets = targets != null ? List.copyOf(targets) : List.of();
        status = status != null ? status : SubtaskStatus.PENDING;
    }

    public static Subtask pending(
            String taskId,
            String suffix,
            String description,
            String capability,
            List<String> dependsOn,
            List<String> targets) {
        return new Subtask(idFor(taskId, suffix), taskId, description, capability,
            dependsOn, targets, SubtaskStatus.PENDING);
    }

    public static String idFor(String taskId, String suffix) {
        return taskId + ":" + suffix;
    }

    public Subtask withStatus(SubtaskStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException("Subtask", subtaskId, status.name(), target.name());
        }
        return new Subtask(subtaskId, taskId, description, capability, dependsOn, targets, target);
    }

    public boolean isRoot() {
        return dependsOn.isEmpty();
    }
}
