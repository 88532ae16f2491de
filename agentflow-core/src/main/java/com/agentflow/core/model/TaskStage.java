package com.agentflow.core.model;

/**
 * Lifecycle stages for a Task's pipeline.
 * Every transition is appended to the PipelineState stage history, never overwritten.
 */
public enum TaskStage {
    /**
     * Task accepted, nothing decided yet.
     * Transitions: -> ROUTING, CANCELLED, FAILED
     */
    SUBMITTED,

    /**
     * Complexity classification and decomposition into a subtask graph.
     * Transitions: -> IMPLEMENTING, FAILED, ESCALATED, CANCELLED
     */
    ROUTING,

    /**
     * Planning and implementation subtasks are being dispatched.
     * Transitions: -> REVIEWING, TESTING, COMPLETE, FAILED, ESCALATED, CANCELLED
     */
    IMPLEMENTING,

    /**
     * Implementation work has joined; outcomes are reviewed before validation is dispatched.
     * Transitions: -> TESTING, COMPLETE, FAILED, ESCALATED, CANCELLED
     */
    REVIEWING,

    /**
     * Validation subtasks are being dispatched.
     * Transitions: -> COMPLETE, FAILED, ESCALATED, CANCELLED
     */
    TESTING,

    /**
     * All required work succeeded. Terminal state.
     */
    COMPLETE,

    /**
     * A critical subtask failed with nothing salvageable. Terminal state.
     */
    FAILED,

    /**
     * Retries exhausted on a critical subtask; handed off for human review. Terminal state.
     */
    ESCALATED,

    /**
     * Cancelled externally. Terminal state.
     */
    CANCELLED;

    /**
     * Check if this stage is terminal (no further transitions possible).
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == ESCALATED || this == CANCELLED;
    }

    /**
     * Check if this stage can transition to the target stage.
     */
    public boolean canTransitionTo(TaskStage target) {
        if (target == this) {
            return false;
        }
        return switch (this) {
            case SUBMITTED -> target == ROUTING || target == CANCELLED || target == FAILED;
            case ROUTING -> target == IMPLEMENTING || target == FAILED ||
                            target == ESCALATED || target == CANCELLED;
            case IMPLEMENTING -> target == REVIEWING || target == TESTING || target == COMPLETE ||
                                 target == FAILED || target == ESCALATED || target == CANCELLED;
            case REVIEWING -> target == TESTING || target == COMPLETE || target == FAILED ||
                              target == ESCALATED || target == CANCELLED;
            case TESTING -> target == COMPLETE || target == FAILED ||
                            target == ESCALATED || target == CANCELLED;
            case COMPLETE, FAILED, ESCALATED, CANCELLED -> false;
        };
    }
}
