package com.agentflow.engine.persistence;

import com.agentflow.core.model.PipelineState;
import com.agentflow.core.repository.PipelineStateRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of PipelineStateRepository.
 * Used when no snapshot directory is configured, and in tests.
 */
public class InMemoryPipelineStateRepository implements PipelineStateRepository {

    private final Map<String, PipelineState> states = new ConcurrentHashMap<>();

    @Override
    public void save(PipelineState state) {
        states.put(state.taskId(), state);
    }

    @Override
    public Optional<PipelineState> findById(String taskId) {
        return Optional.ofNullable(states.get(taskId));
    }

    @Override
    public List<String> findActiveTaskIds() {
        return states.values().stream()
            .filter(s -> !s.isTerminal())
            .map(PipelineState::taskId)
            .toList();
    }

    @Override
    public List<PipelineState> findArchivedSince(Instant since) {
        return states.values().stream()
            .filter(PipelineState::isArchived)
            .filter(s -> !s.archivedAt().isBefore(since))
            .sorted(Comparator.comparing(PipelineState::archivedAt))
            .toList();
    }

    @Override
    public long count() {
        return states.size();
    }
}
