package com.agentflow.worker;

/**
 * A worker registered for one capability.
 *
 * @param serviceKey key under which calls to this worker are rate limited and circuit broken
 * @param slots how many calls this worker accepts concurrently
 */
public record WorkerRegistration(
    String capability,
    String serviceKey,
    Worker worker,
    int slots
) {
    public WorkerRegistration {
        if (slots < 1) {
            throw new IllegalArgumentException("slots must be >= 1");
        }
    }
}
