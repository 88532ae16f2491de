package com.agentflow.core.exception;

/**
 * Base exception for all orchestrator errors.
 * Carries a stable error code and, where known, the Task the error pertains to.
 */
public class OrchestratorException extends RuntimeException {

    private final String errorCode;
    private final String taskId;

    public OrchestratorException(String errorCode, String message) {
        this(errorCode, null, message, null);
    }

    public OrchestratorException(String errorCode, String message, Throwable cause) {
        this(errorCode, null, message, cause);
    }

    public OrchestratorException(String errorCode, String taskId, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.taskId = taskId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * @return the affected Task id, or null when the error is not Task-scoped
     */
    public String getTaskId() {
        return taskId;
    }
}
