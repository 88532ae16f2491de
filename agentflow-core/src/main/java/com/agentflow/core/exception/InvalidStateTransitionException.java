package com.agentflow.core.exception;

import com.agentflow.core.model.TaskStage;

/**
 * Thrown when a TaskStage or SubtaskStatus transition is not allowed by its state machine.
 */
public class InvalidStateTransitionException extends OrchestratorException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(String taskId, TaskStage currentStage, TaskStage targetStage) {
        super(ERROR_CODE, taskId, String.format(
            "Cannot transition task %s from %s to %s",
            taskId, currentStage, targetStage
        ), null);
    }

    public InvalidStateTransitionException(String entityType, String entityId, String currentState, String targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition %s %s from %s to %s",
            entityType, entityId, currentState, targetState
        ));
    }
}
