package com.agentflow.worker;

/**
 * Thrown by workers that could not produce a result.
 * Non-retryable (permanent) failures end the subtask without trying further strategies.
 */
public class WorkerException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public WorkerException(String errorCode, String message) {
        this(errorCode, message, null, true);
    }

    public WorkerException(String errorCode, String message, boolean retryable) {
        this(errorCode, message, null, retryable);
    }

    public WorkerException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static WorkerException permanent(String errorCode, String message) {
        return new WorkerException(errorCode, message, false);
    }

    /**
     * Create a retryable exception (transient failure).
     */
    public static WorkerException retryable(String errorCode, String message) {
        return new WorkerException(errorCode, message, true);
    }
}
