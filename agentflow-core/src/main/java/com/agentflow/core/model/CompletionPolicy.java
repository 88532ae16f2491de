package com.agentflow.core.model;

/**
 * How failures of subtasks that nothing else depends on affect the Task verdict.
 */
public enum CompletionPolicy {
    /**
     * Off-critical-path failures are recorded but the Task completes as long as
     * at least one final subtask succeeded.
     */
    GRACEFUL_DEGRADATION,

    /**
     * Any failed subtask escalates the Task.
     */
    ALL_OR_NOTHING
}
