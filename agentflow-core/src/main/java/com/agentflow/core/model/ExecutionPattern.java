package com.agentflow.core.model;

/**
 * Shape of a Task's subtask graph.
 */
public enum ExecutionPattern {
    /** One subtask, no fan-out. */
    SINGLE,
    /** Implementation followed by validation. */
    PIPELINE,
    /** Planning, N parallel implementations, then one validation joining them all. */
    FORK_JOIN
}
