package com.agentflow.core.repository;

import com.agentflow.core.model.PipelineState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for PipelineState snapshots.
 * States are upserted on every change and never deleted; terminal states are kept as the audit trail.
 */
public interface PipelineStateRepository {

    /**
     * Save (insert or replace) the snapshot for a task.
     *
     * @param state The pipeline state to save
     */
    void save(PipelineState state);

    /**
     * Find the snapshot for a task.
     *
     * @param taskId The task ID
     * @return The pipeline state if found
     * @throws com.agentflow.core.exception.CorruptStateException if the stored snapshot is unreadable
     */
    Optional<PipelineState> findById(String taskId);

    /**
     * Find ids of tasks whose pipeline has not reached a terminal stage.
     * Returns ids rather than states so a single unreadable snapshot cannot hide the others.
     *
     * @return Task ids, in no particular order
     */
    List<String> findActiveTaskIds();

    /**
     * Find archived (terminal) pipelines archived at or after the given time.
     * Unreadable snapshots are skipped.
     *
     * @param since Lower bound on archive time
     * @return Archived pipeline states
     */
    List<PipelineState> findArchivedSince(Instant since);

    /**
     * Count stored pipelines, active and archived.
     */
    long count();
}
