package com.agentflow.core.model;

/**
 * Status of a single subtask within a Task's graph.
 */
public enum SubtaskStatus {
    /**
     * Waiting on dependencies.
     * Transitions: -> READY, SKIPPED
     */
    PENDING,

    /**
     * All dependencies succeeded; eligible for dispatch (possibly parked on admission backoff).
     * Transitions: -> RUNNING, SKIPPED
     */
    READY,

    /**
     * Dispatched to a worker.
     * Transitions: -> SUCCEEDED, FAILED, READY (retry with the next strategy)
     */
    RUNNING,

    /**
     * Terminal.
     */
    SUCCEEDED,

    /**
     * No strategy left, or a permanent worker error. Terminal.
     */
    FAILED,

    /**
     * Never dispatched: cancelled, or an ancestor failed terminally. Terminal.
     */
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }

    public boolean canTransitionTo(SubtaskStatus target) {
        return switch (this) {
            case PENDING -> target == READY || target == SKIPPED;
            case READY -> target == RUNNING || target == SKIPPED;
            case RUNNING -> target == SUCCEEDED || target == FAILED || target == READY;
            case SUCCEEDED, FAILED, SKIPPED -> false;
        };
    }
}
