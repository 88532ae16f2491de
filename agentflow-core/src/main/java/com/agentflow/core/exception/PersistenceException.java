package com.agentflow.core.exception;

/**
 * Thrown when a pipeline snapshot cannot be written.
 */
public class PersistenceException extends OrchestratorException {

    public static final String ERROR_CODE = "PERSISTENCE_ERROR";

    public PersistenceException(String taskId, String message) {
        super(ERROR_CODE, taskId, message, null);
    }

    public PersistenceException(String taskId, String message, Throwable cause) {
        super(ERROR_CODE, taskId, message, cause);
    }
}
