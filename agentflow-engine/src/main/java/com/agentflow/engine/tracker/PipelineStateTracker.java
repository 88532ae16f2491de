package com.agentflow.engine.tracker;

import com.agentflow.core.exception.CorruptStateException;
import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.exception.PersistenceException;
import com.agentflow.core.model.AgentAttempt;
import com.agentflow.core.model.EscalationRecord;
import com.agentflow.core.model.FailureSignature;
import com.agentflow.core.model.PipelineState;
import com.agentflow.core.model.RetryPolicy;
import com.agentflow.core.model.Strategy;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskStage;
import com.agentflow.core.repository.PipelineStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records every attempt made on a Task, decides the next strategy and builds escalation records.
 *
 * The tracker owns one {@link PipelineState} per active task. Updates to the same task are
 * serialized; different tasks proceed independently. Every change is written through to
 * the repository so a restarted process resumes from the last recorded attempt.
 *
 * Running out of strategies is an expected outcome, reported as an empty
 * {@link #nextStrategy(String, String)}. The only hard failure is
 * {@link CorruptStateException} when persisted history cannot be trusted.
 */
public class PipelineStateTracker {

    private static final Logger log = LoggerFactory.getLogger(PipelineStateTracker.class);

    private final PipelineStateRepository repository;
    private final FailureClassifier classifier;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final Map<String, PipelineState> states = new ConcurrentHashMap<>();

    public PipelineStateTracker(
            PipelineStateRepository repository,
            FailureClassifier classifier,
            RetryPolicy retryPolicy,
            Clock clock) {
        this.repository = repository;
        this.classifier = classifier;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    // ========== Lifecycle ==========

    public PipelineState begin(Task task) {
        PipelineState initial = PipelineState.initial(task, retryPolicy.maxRetries(), clock.instant());
        PipelineState existing = states.putIfAbsent(task.taskId(), initial);
        if (existing != null) {
            return existing;
        }
        persist(initial);
        log.debug("Tracking pipeline for task {}", task.taskId());
        return initial;
    }

    /**
     * Load a persisted pipeline and verify its history before trusting it.
     *
     * @throws NotFoundException if nothing was persisted for the task
     * @throws CorruptStateException if the snapshot is unreadable or inconsistent
     */
    public PipelineState load(String taskId) {
        PipelineState state = repository.findById(taskId)
            .orElseThrow(() -> new NotFoundException("PipelineState", taskId));
        state.verifyIntegrity();
        if (!state.isTerminal()) {
            states.put(taskId, state);
        }
        log.info("Loaded pipeline for task {} at stage {} with {} attempts",
            taskId, state.stage(), state.attempts().size());
        return state;
    }

    public PipelineState state(String taskId) {
        return find(taskId).orElseThrow(() -> new NotFoundException("PipelineState", taskId));
    }

    public Optional<PipelineState> find(String taskId) {
        PipelineState state = states.get(taskId);
        if (state != null) {
            return Optional.of(state);
        }
        return repository.findById(taskId);
    }

    public boolean isTracking(String taskId) {
        return states.containsKey(taskId);
    }

    public List<PipelineState> activeStates() {
        return List.copyOf(states.values());
    }

    // ========== Attempts ==========

    /**
     * Append an attempt to the task's history. Failures are classified before they are stored.
     * Recording an attempt whose id is already present is a no-op.
     *
     * @return the attempt as stored
     * @throws IllegalArgumentException if the attempt number is not the next one for its subtask
     */
    public AgentAttempt recordAttempt(String taskId, AgentAttempt attempt) {
        List<AgentAttempt> stored = new ArrayList<>(1);
        PipelineState updated = update(taskId, current -> {
            for (AgentAttempt existing : current.attempts()) {
                if (existing.attemptId() != null && existing.attemptId().equals(attempt.attemptId())) {
                    stored.add(existing);
                    return current;
                }
            }
            int expected = current.nextAttemptNumber(attempt.subtaskId());
            if (attempt.attemptNumber() != expected) {
                throw new IllegalArgumentException(String.format(
                    "Attempt %d for %s is out of order, expected %d",
                    attempt.attemptNumber(), attempt.subtaskId(), expected));
            }
            AgentAttempt classified = attempt;
            if (attempt.isFailure() && attempt.errorClassification() == null) {
                classified = attempt.withClassification(classifier.classify(attempt, current.task()));
            }
            stored.add(classified);
            return current.withAttempt(classified, clock.instant());
        });

        AgentAttempt recorded = stored.get(0);
        if (recorded.isFailure()) {
            log.info("Recorded failed attempt {} of {} [{}]: {} (retry {}/{})",
                recorded.attemptNumber(), recorded.subtaskId(), recorded.strategy().value(),
                recorded.errorClassification().value(), updated.retryCount(), updated.maxRetries());
        } else {
            log.info("Recorded successful attempt {} of {} [{}]",
                recorded.attemptNumber(), recorded.subtaskId(), recorded.strategy().value());
        }
        return recorded;
    }

    /**
     * Strategy for the next attempt on a subtask, or empty when the retry ceiling is reached
     * or every strategy has been tried for it.
     */
    public Optional<Strategy> nextStrategy(String taskId, String subtaskId) {
        PipelineState state = state(taskId);
        return retryPolicy.withMaxRetries(state.maxRetries())
            .nextStrategy(state.triedStrategies(subtaskId), state.retryCount());
    }

    public int retryCount(String taskId) {
        return state(taskId).retryCount();
    }

    // ========== Stages ==========

    public PipelineState transition(String taskId, TaskStage target, String reason) {
        PipelineState updated = update(taskId, current -> current.withStage(target, reason, clock.instant()));
        log.info("Task {} -> {} ({})", taskId, target, reason);
        return updated;
    }

    /**
     * Archive a terminal pipeline. The snapshot stays in the repository as the audit trail.
     */
    public PipelineState archive(String taskId) {
        PipelineState archived = update(taskId, current -> current.archived(clock.instant()));
        states.remove(taskId);
        return archived;
    }

    // ========== Escalation ==========

    public EscalationRecord escalate(String taskId) {
        return escalate(taskId, null, "retry ceiling reached");
    }

    /**
     * Build the hand-off record for a task that cannot be resolved automatically.
     * The recommended next step follows the most frequent failure signature; ties go to
     * the one seen most recently.
     */
    public EscalationRecord escalate(String taskId, String failedSubtaskId, String reason) {
        PipelineState state = state(taskId);
        FailureSignature dominant = dominantSignature(state.attempts());
        String nextStep = dominant != null
            ? dominant.nextStepHint()
            : FailureSignature.UNKNOWN.nextStepHint();
        return new EscalationRecord(
            taskId,
            state.task() != null ? state.task().description() : "",
            failedSubtaskId,
            reason,
            state.attempts(),
            List.copyOf(state.failurePatterns()),
            state.touchedTargets(),
            nextStep,
            clock.instant()
        );
    }

    static FailureSignature dominantSignature(List<AgentAttempt> attempts) {
        Map<FailureSignature, Integer> counts = new EnumMap<>(FailureSignature.class);
        FailureSignature dominant = null;
        int best = 0;
        for (AgentAttempt attempt : attempts) {
            if (!attempt.isFailure() || attempt.errorClassification() == null) {
                continue;
            }
            int count = counts.merge(attempt.errorClassification(), 1, Integer::sum);
            if (count >= best) {
                best = count;
                dominant = attempt.errorClassification();
            }
        }
        return dominant;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public Instant now() {
        return clock.instant();
    }

    // ========== Internal ==========

    private interface StateUpdate {
        PipelineState apply(PipelineState current);
    }

    /**
     * Apply a change under the task's map entry so snapshots are written in update order.
     */
    private PipelineState update(String taskId, StateUpdate change) {
        PipelineState updated = states.compute(taskId, (id, current) -> {
            if (current == null) {
                throw new NotFoundException("PipelineState", id);
            }
            PipelineState next = change.apply(current);
            if (next != current) {
                persist(next);
            }
            return next;
        });
        return updated;
    }

    private void persist(PipelineState state) {
        try {
            repository.save(state);
        } catch (PersistenceException e) {
            // In-memory state stays authoritative; the next successful save catches up
            log.error("Failed to persist pipeline state for task {}: {}", state.taskId(), e.getMessage(), e);
        }
    }
}
