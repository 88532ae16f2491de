package com.agentflow.engine.decomposition;

import com.agentflow.core.model.SubtaskGraph;
import com.agentflow.core.model.Task;

/**
 * Turns a task into a validated dependency graph of subtasks.
 * Must be deterministic: the same task always yields the same graph, so a graph can be
 * re-derived when a pipeline is resumed from its persisted attempts.
 */
public interface Decomposer {

    /**
     * @throws com.agentflow.core.exception.GraphValidationException if the produced graph is invalid
     */
    SubtaskGraph decompose(Task task);
}
