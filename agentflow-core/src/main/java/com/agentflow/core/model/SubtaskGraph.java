package com.agentflow.core.model;

import com.agentflow.core.exception.GraphValidationException;
import com.agentflow.core.exception.InvalidStateTransitionException;
import com.agentflow.core.exception.NotFoundException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency graph of a Task's subtasks.
 *
 * Structure is fixed at build time and validated as a DAG. Subtask statuses are
 * mutable and driven only by the orchestrator; every status change goes through
 * {@link #transition(String, SubtaskStatus)}, which enforces the status machine and the
 * rule that nothing runs before all of its dependencies have succeeded.
 */
public final class SubtaskGraph {

    private final String taskId;
    private final ComplexityTier tier;
    private final ExecutionPattern pattern;
    private final Map<String, Subtask> subtasks;
    private final Map<String, List<String>> dependents;

    private SubtaskGraph(String taskId, ComplexityTier tier, ExecutionPattern pattern, List<Subtask> nodes) {
        this.taskId = taskId;
        this.tier = tier;
        this.pattern = pattern;
        this.subtasks = new LinkedHashMap<>();
        nodes.forEach(s -> subtasks.put(s.subtaskId(), s));
        this.dependents = new HashMap<>();
        for (Subtask subtask : nodes) {
            for (String dependency : subtask.dependsOn()) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(subtask.subtaskId());
            }
        }
    }

    public String taskId() {
        return taskId;
    }

    public ComplexityTier tier() {
        return tier;
    }

    public ExecutionPattern pattern() {
        return pattern;
    }

    public synchronized List<Subtask> subtasks() {
        return List.copyOf(subtasks.values());
    }

    public synchronized Subtask get(String subtaskId) {
        Subtask subtask = subtasks.get(subtaskId);
        if (subtask == null) {
            throw new NotFoundException("Subtask", subtaskId);
        }
        return subtask;
    }

    public int size() {
        return subtasks.size();
    }

    // ========== Status transitions ==========

    /**
     * Move a subtask to a new status.
     *
     * @throws InvalidStateTransitionException if the status
     *         machine forbids it, or if RUNNING is requested before all dependencies succeeded
     */
    public synchronized Subtask transition(String subtaskId, SubtaskStatus target) {
        Subtask current = get(subtaskId);
        if (target == SubtaskStatus.RUNNING && !dependenciesSucceeded(current)) {
            throw new InvalidStateTransitionException(
                "Subtask", subtaskId, current.status().name(), "RUNNING with unfinished dependencies");
        }
        Subtask updated = current.withStatus(target);
        subtasks.put(subtaskId, updated);
        return updated;
    }

    /**
     * Promote every PENDING subtask whose dependencies all succeeded to READY.
     *
     * @return the subtasks promoted by this call
     */
    public synchronized List<Subtask> promoteReady() {
        List<Subtask> promoted = new ArrayList<>();
        for (Subtask subtask : List.copyOf(subtasks.values())) {
            if (subtask.status() == SubtaskStatus.PENDING && dependenciesSucceeded(subtask)) {
                promoted.add(transition(subtask.subtaskId(), SubtaskStatus.READY));
            }
        }
        return promoted;
    }

    public synchronized List<Subtask> withStatus(SubtaskStatus status) {
        return subtasks.values().stream()
            .filter(s -> s.status() == status)
            .toList();
    }

    /**
     * Mark every not-yet-started subtask SKIPPED.
     *
     * @return ids of the subtasks skipped
     */
    public synchronized List<String> skipNotStarted() {
        List<String> skipped = new ArrayList<>();
        for (Subtask subtask : List.copyOf(subtasks.values())) {
            if (subtask.status() == SubtaskStatus.PENDING || subtask.status() == SubtaskStatus.READY) {
                transition(subtask.subtaskId(), SubtaskStatus.SKIPPED);
                skipped.add(subtask.subtaskId());
            }
        }
        return skipped;
    }

    /**
     * Mark every not-yet-started descendant of a terminally failed subtask SKIPPED.
     */
    public synchronized List<String> skipDescendants(String subtaskId) {
        List<String> skipped = new ArrayList<>();
        for (String descendant : descendants(subtaskId)) {
            SubtaskStatus status = subtasks.get(descendant).status();
            if (status == SubtaskStatus.PENDING || status == SubtaskStatus.READY) {
                transition(descendant, SubtaskStatus.SKIPPED);
                skipped.add(descendant);
            }
        }
        return skipped;
    }

    // ========== Queries ==========

    public synchronized boolean dependenciesSucceeded(Subtask subtask) {
        for (String dependency : subtask.dependsOn()) {
            Subtask upstream = subtasks.get(dependency);
            if (upstream == null || upstream.status() != SubtaskStatus.SUCCEEDED) {
                return false;
            }
        }
        return true;
    }

    public List<String> dependents(String subtaskId) {
        return dependents.getOrDefault(subtaskId, List.of());
    }

    /**
     * A subtask is on the critical path when another not-yet-finished subtask depends on it.
     */
    public synchronized boolean isCriticalPath(String subtaskId) {
        return dependents(subtaskId).stream()
            .map(subtasks::get)
            .anyMatch(s -> !s.status().isTerminal());
    }

    public Set<String> descendants(String subtaskId) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(dependents(subtaskId));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (seen.add(next)) {
                queue.addAll(dependents(next));
            }
        }
        return seen;
    }

    /**
     * Subtasks nothing else depends on: the Task's final deliverables.
     */
    public synchronized List<Subtask> sinks() {
        return subtasks.values().stream()
            .filter(s -> dependents(s.subtaskId()).isEmpty())
            .toList();
    }

    public synchronized boolean allTerminal() {
        return subtasks.values().stream().allMatch(s -> s.status().isTerminal());
    }

    public synchronized Map<String, SubtaskStatus> statusSnapshot() {
        Map<String, SubtaskStatus> snapshot = new LinkedHashMap<>();
        subtasks.values().forEach(s -> snapshot.put(s.subtaskId(), s.status()));
        return Collections.unmodifiableMap(snapshot);
    }

    public List<String> topologicalOrder() {
        return topologicalOrder(List.copyOf(subtasks.values()));
    }

    // ========== Builder ==========

    public static Builder builder(String taskId, ComplexityTier tier, ExecutionPattern pattern) {
        return new Builder(taskId, tier, pattern);
    }

    public static class Builder {
        private final String taskId;
        private final ComplexityTier tier;
        private final ExecutionPattern pattern;
        private final List<Subtask> subtasks = new ArrayList<>();

        private Builder(String taskId, ComplexityTier tier, ExecutionPattern pattern) {
            this.taskId = taskId;
            this.tier = tier;
            this.pattern = pattern;
        }

        public Builder add(Subtask subtask) {
            subtasks.add(subtask);
            return this;
        }

        /**
         * @throws GraphValidationException on duplicate ids, foreign or dangling
         *         dependencies, or a cycle
         */
        public SubtaskGraph build() {
            validate();
            return new SubtaskGraph(taskId, tier, pattern, subtasks);
        }

        private void validate() {
            List<String> violations = new ArrayList<>();
            if (subtasks.isEmpty()) {
                violations.add("graph has no subtasks");
            }
            Set<String> ids = new HashSet<>();
            for (Subtask subtask : subtasks) {
                if (!ids.add(subtask.subtaskId())) {
                    violations.add("duplicate subtask id " + subtask.subtaskId());
                }
                if (!subtask.taskId().equals(taskId)) {
                    violations.add("subtask " + subtask.subtaskId() + " belongs to task " + subtask.taskId());
                }
                if (subtask.status() != SubtaskStatus.PENDING) {
                    violations.add("subtask " + subtask.subtaskId() + " must start PENDING");
                }
            }
            for (Subtask subtask : subtasks) {
                for (String dependency : subtask.dependsOn()) {
                    if (!ids.contains(dependency)) {
                        violations.add("subtask " + subtask.subtaskId() + " depends on unknown " + dependency);
                    }
                }
            }
            if (violations.isEmpty() && topologicalOrder(subtasks).size() != subtasks.size()) {
                violations.add("dependency cycle detected");
            }
            if (!violations.isEmpty()) {
                throw new GraphValidationException(taskId, violations);
            }
        }
    }

    /**
     * Kahn's algorithm; returns fewer ids than nodes when the graph has a cycle.
     */
    private static List<String> topologicalOrder(List<Subtask> nodes) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> edges = new HashMap<>();
        for (Subtask subtask : nodes) {
            inDegree.put(subtask.subtaskId(), subtask.dependsOn().size());
            for (String dependency : subtask.dependsOn()) {
                edges.computeIfAbsent(dependency, k -> new ArrayList<>()).add(subtask.subtaskId());
            }
        }
        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });
        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String next : edges.getOrDefault(id, List.of())) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        return order;
    }
}
