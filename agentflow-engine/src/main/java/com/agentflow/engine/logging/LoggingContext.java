package com.agentflow.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helper for structured logging.
 * Ensures pipeline logs carry the task, subtask and attempt they belong to.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forSubtask(taskId, subtaskId, attempt, strategy, serviceKey)) {
 *     log.info("Dispatching"); // includes taskId, subtaskId, attempt, strategy, serviceKey
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [agentflow-worker-3] INFO  c.a.e.o.TaskOrchestrator - Dispatching
 *   taskId=issue-42 subtaskId=issue-42:impl-1 attempt=2 strategy=mechanical-fix
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TASK_ID = "taskId";
    public static final String SUBTASK_ID = "subtaskId";
    public static final String ATTEMPT = "attempt";
    public static final String STRATEGY = "strategy";
    public static final String SERVICE_KEY = "serviceKey";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Use static factory methods
    }

    /**
     * Create a logging context for pipeline-level operations.
     */
    public static LoggingContext forTask(String taskId) {
        LoggingContext ctx = new LoggingContext();
        if (taskId != null) {
            MDC.put(TASK_ID, taskId);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for one dispatched attempt.
     */
    public static LoggingContext forSubtask(String taskId, String subtaskId, int attempt,
                                            String strategy, String serviceKey) {
        LoggingContext ctx = forTask(taskId);
        if (subtaskId != null) {
            MDC.put(SUBTASK_ID, subtaskId);
        }
        MDC.put(ATTEMPT, String.valueOf(attempt));
        if (strategy != null) {
            MDC.put(STRATEGY, strategy);
        }
        if (serviceKey != null) {
            MDC.put(SERVICE_KEY, serviceKey);
        }
        return ctx;
    }

    public static String getTaskId() {
        return MDC.get(TASK_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(TASK_ID);
        MDC.remove(SUBTASK_ID);
        MDC.remove(ATTEMPT);
        MDC.remove(STRATEGY);
        MDC.remove(SERVICE_KEY);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request or a worker thread's task.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
