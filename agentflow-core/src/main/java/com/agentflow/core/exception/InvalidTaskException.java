package com.agentflow.core.exception;

/**
 * Thrown when a submitted task is rejected before any state is created:
 * empty description, description over the configured size ceiling, or a malformed id.
 */
public class InvalidTaskException extends OrchestratorException {

    public static final String ERROR_CODE = "INVALID_TASK";

    public InvalidTaskException(String reason) {
        super(ERROR_CODE, "Invalid task: " + reason);
    }

    public InvalidTaskException(String taskId, String reason) {
        super(ERROR_CODE, taskId, String.format("Invalid task %s: %s", taskId, reason), null);
    }
}
