package com.agentflow.core.exception;

/**
 * Thrown when persisted pipeline history cannot be read or is internally inconsistent.
 * Fatal for the affected Task only; the Task must be resubmitted fresh.
 */
public class CorruptStateException extends OrchestratorException {

    public static final String ERROR_CODE = "CORRUPT_STATE";

    public CorruptStateException(String taskId, String detail) {
        super(ERROR_CODE, taskId, String.format(
            "Corrupt pipeline state for task %s: %s",
            taskId, detail
        ), null);
    }

    public CorruptStateException(String taskId, String detail, Throwable cause) {
        super(ERROR_CODE, taskId, String.format(
            "Corrupt pipeline state for task %s: %s",
            taskId, detail
        ), cause);
    }
}
