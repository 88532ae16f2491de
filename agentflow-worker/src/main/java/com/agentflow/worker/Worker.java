package com.agentflow.worker;

/**
 * An external, opaque executor that attempts one subtask.
 * Implementations may be slow and may fail; the orchestrator assumes nothing about their internals.
 */
@FunctionalInterface
public interface Worker {

    /**
     * Attempt the subtask described by the request using the requested strategy.
     *
     * @param request Subtask, strategy and prior attempt context
     * @return The result; a failed result is an ordinary outcome, not an exception
     * @throws WorkerException if the worker could not produce a result at all
     */
    WorkerResult execute(WorkerRequest request) throws WorkerException;
}
