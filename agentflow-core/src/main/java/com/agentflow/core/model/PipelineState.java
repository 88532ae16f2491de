package com.agentflow.core.model;

import com.agentflow.core.exception.CorruptStateException;
import com.agentflow.core.exception.InvalidStateTransitionException;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The audit trail of one Task's journey: stage history and every attempt made.
 * Immutable; each update produces a new instance. Archived, never deleted, at a terminal stage.
 *
 * Retry count, tried strategies and failure-pattern tags are all derived from the
 * attempt list, so replaying the same attempts always reconstructs the same state.
 */
public record PipelineState(
    String taskId,
    Task task,
    TaskStage stage,
    List<StageTransition> stageHistory,
    List<AgentAttempt> attempts,
    int maxRetries,
    Instant updatedAt,
    Instant archivedAt
) {
    public PipelineState {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(stage, "stage");
        stageHistory = stageHistory != null ? List.copyOf(stageHistory) : List.of();
        attempts = attempts != null ? List.copyOf(attempts) : List.of();
    }

    /**
     * Create the initial state for a freshly submitted task.
     */
    public static PipelineState initial(Task task, int maxRetries, Instant now) {
        return new PipelineState(
            task.taskId(),
            task,
            TaskStage.SUBMITTED,
            List.of(new StageTransition(null, TaskStage.SUBMITTED, now, "submitted")),
            List.of(),
            maxRetries,
            now,
            null
        );
    }

    // ========== Updates ==========

    public PipelineState withAttempt(AgentAttempt attempt, Instant now) {
        List<AgentAttempt> updated = new ArrayList<>(attempts);
        updated.add(attempt);
        return new PipelineState(taskId, task, stage, stageHistory, updated, maxRetries, now, archivedAt);
    }

    /**
     * @throws InvalidStateTransitionException if the stage machine forbids the move
     */
    public PipelineState withStage(TaskStage target, String reason, Instant now) {
        if (!stage.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(taskId, stage, target);
        }
        List<StageTransition> history = new ArrayList<>(stageHistory);
        history.add(new StageTransition(stage, target, now, reason));
        return new PipelineState(taskId, task, target, history, attempts, maxRetries, now, archivedAt);
    }

    public PipelineState archived(Instant now) {
        return new PipelineState(taskId, task, stage, stageHistory, attempts, maxRetries, now, now);
    }

    // ========== Derived views ==========

    /**
     * Number of failed attempts across the task, saturating at maxRetries.
     */
    public int retryCount() {
        long failures = attempts.stream().filter(AgentAttempt::isFailure).count();
        return (int) Math.min(failures, maxRetries);
    }

    public boolean retriesExhausted() {
        return retryCount() >= maxRetries;
    }

    public List<AgentAttempt> attemptsFor(String subtaskId) {
        return attempts.stream()
            .filter(a -> a.subtaskId().equals(subtaskId))
            .toList();
    }

    public int nextAttemptNumber(String subtaskId) {
        return attemptsFor(subtaskId).size() + 1;
    }

    public Set<Strategy> triedStrategies(String subtaskId) {
        Set<Strategy> tried = EnumSet.noneOf(Strategy.class);
        for (AgentAttempt attempt : attempts) {
            if (attempt.subtaskId().equals(subtaskId)) {
                tried.add(attempt.strategy());
            }
        }
        return tried;
    }

    public Set<Strategy> triedStrategies() {
        Set<Strategy> tried = EnumSet.noneOf(Strategy.class);
        attempts.forEach(a -> tried.add(a.strategy()));
        return tried;
    }

    /**
     * Failure signatures in the order they were first seen.
     */
    public Set<FailureSignature> failurePatterns() {
        Set<FailureSignature> patterns = new LinkedHashSet<>();
        for (AgentAttempt attempt : attempts) {
            if (attempt.isFailure() && attempt.errorClassification() != null) {
                patterns.add(attempt.errorClassification());
            }
        }
        return Collections.unmodifiableSet(patterns);
    }

    public boolean hasSucceeded(String subtaskId) {
        return attempts.stream().anyMatch(a -> a.subtaskId().equals(subtaskId) && a.isSuccess());
    }

    /**
     * Union of targets reported by successful attempts, in first-seen order.
     */
    public List<String> touchedTargets() {
        Set<String> targets = new LinkedHashSet<>();
        attempts.stream()
            .filter(AgentAttempt::isSuccess)
            .forEach(a -> targets.addAll(a.touchedTargets()));
        return List.copyOf(targets);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return stage.isTerminal();
    }

    @JsonIgnore
    public boolean isArchived() {
        return archivedAt != null;
    }

    // ========== Integrity ==========

    /**
     * Verify the history is internally consistent. Used when reloading persisted state.
     *
     * @throws CorruptStateException describing the first inconsistency found
     */
    public void verifyIntegrity() {
        if (task == null) {
            throw new CorruptStateException(taskId, "missing task");
        }
        if (!taskId.equals(task.taskId())) {
            throw new CorruptStateException(taskId, "task id mismatch: " + task.taskId());
        }
        if (maxRetries < 1) {
            throw new CorruptStateException(taskId, "maxRetries must be >= 1, was " + maxRetries);
        }
        verifyStageHistory();
        verifyAttempts();
    }

    private void verifyStageHistory() {
        if (stageHistory.isEmpty()) {
            throw new CorruptStateException(taskId, "empty stage history");
        }
        StageTransition first = stageHistory.get(0);
        if (first.from() != null || first.to() != TaskStage.SUBMITTED) {
            throw new CorruptStateException(taskId, "stage history must start with SUBMITTED");
        }
        TaskStage current = TaskStage.SUBMITTED;
        for (StageTransition transition : stageHistory.subList(1, stageHistory.size())) {
            if (transition.from() != current || !current.canTransitionTo(transition.to())) {
                throw new CorruptStateException(taskId, String.format(
                    "illegal stage transition %s -> %s", transition.from(), transition.to()));
            }
            current = transition.to();
        }
        if (current != stage) {
            throw new CorruptStateException(taskId, String.format(
                "stage %s does not match history end %s", stage, current));
        }
    }

    private void verifyAttempts() {
        String prefix = taskId + ":";
        Map<String, Integer> lastNumber = new HashMap<>();
        for (AgentAttempt attempt : attempts) {
            if (!attempt.subtaskId().startsWith(prefix)) {
                throw new CorruptStateException(taskId, "attempt for foreign subtask " + attempt.subtaskId());
            }
            int expected = lastNumber.getOrDefault(attempt.subtaskId(), 0) + 1;
            if (attempt.attemptNumber() != expected) {
                throw new CorruptStateException(taskId, String.format(
                    "attempt numbers for %s are not contiguous: expected %d, found %d",
                    attempt.subtaskId(), expected, attempt.attemptNumber()));
            }
            if (attempt.startedAt() != null && attempt.completedAt() != null
                    && attempt.completedAt().isBefore(attempt.startedAt())) {
                throw new CorruptStateException(taskId, "attempt " + attempt.attemptId() + " ends before it starts");
            }
            if (attempt.isFailure() && attempt.errorClassification() == null) {
                throw new CorruptStateException(taskId, "unclassified failure " + attempt.attemptId());
            }
            lastNumber.put(attempt.subtaskId(), expected);
        }
    }
}
