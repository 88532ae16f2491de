package com.agentflow.engine.orchestrator;

import com.agentflow.core.model.Strategy;
import com.agentflow.core.model.Subtask;
import com.agentflow.core.model.SubtaskGraph;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskStage;
import com.agentflow.core.model.Verdict;
import com.agentflow.worker.WorkerException;
import com.agentflow.worker.WorkerResult;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runtime bookkeeping for one pipeline while it executes.
 *
 * Owned by the coordinating thread. Worker and timeout threads only touch it through
 * {@link Dispatch#report(TaskRun, Outcome)}, which posts to the event queue; cancellation
 * requests set a flag and wake the coordinator.
 */
final class TaskRun {

    final Task task;
    final boolean resumed;
    final BlockingQueue<Event> events = new LinkedBlockingQueue<>();
    final Map<String, Dispatch> inFlight = new ConcurrentHashMap<>();
    final Map<String, Parking> parked = new HashMap<>();
    final Map<String, Strategy> plannedStrategies = new HashMap<>();
    final List<String> degraded = new ArrayList<>();
    final Set<String> permanentFailures = new LinkedHashSet<>();
    final List<String> skippedByCancel = new ArrayList<>();
    final CompletableFuture<Verdict> verdict = new CompletableFuture<>();

    private final AtomicBoolean claimed = new AtomicBoolean();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    volatile SubtaskGraph graph;
    volatile String cancelReason;
    volatile boolean waitingForSlot;
    boolean cancelApplied;

    TaskStage haltStage;
    String haltSubtaskId;
    String haltReason;

    TaskRun(Task task, boolean resumed) {
        this.task = task;
        this.resumed = resumed;
    }

    String taskId() {
        return task.taskId();
    }

    /**
     * Claim the right to drive this pipeline. Only the first caller wins.
     */
    boolean claim() {
        return claimed.compareAndSet(false, true);
    }

    boolean requestCancel(String reason) {
        if (cancelRequested.compareAndSet(false, true)) {
            cancelReason = reason;
            wake();
            return true;
        }
        return false;
    }

    boolean isCancelRequested() {
        return cancelRequested.get();
    }

    void wake() {
        events.offer(Event.WAKE);
    }

    void halt(TaskStage stage, String subtaskId, String reason) {
        if (haltStage == null) {
            haltStage = stage;
            haltSubtaskId = subtaskId;
            haltReason = reason;
        }
    }

    boolean isHalted() {
        return haltStage != null;
    }

    boolean conflictsWithInFlight(Subtask subtask) {
        if (subtask.targets().isEmpty()) {
            return false;
        }
        for (Dispatch dispatch : inFlight.values()) {
            if (!Collections.disjoint(dispatch.subtask.targets(), subtask.targets())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Milliseconds until the earliest parked subtask may be retried, bounded by {@code idleMillis}.
     */
    long nextWakeMillis(long idleMillis, long nowNanos) {
        long wait = idleMillis;
        for (Parking parking : parked.values()) {
            long remaining = (parking.untilNanos() - nowNanos) / 1_000_000L;
            wait = Math.min(wait, Math.max(1L, remaining));
        }
        return wait;
    }

    // ========== Dispatch bookkeeping ==========

    record Parking(int deferrals, long untilNanos) {
    }

    record Event(Dispatch dispatch, Outcome outcome) {
        static final Event WAKE = new Event(null, null);

        boolean isWake() {
            return dispatch == null;
        }
    }

    /**
     * One attempt in flight. Exactly one outcome is ever reported for it: whichever of the
     * worker, the timeout or an abort gets there first.
     */
    static final class Dispatch {
        final Subtask subtask;
        final String serviceKey;
        final Strategy strategy;
        final int attemptNumber;
        final Instant startedAt;
        private final AtomicBoolean reported = new AtomicBoolean();
        volatile Future<?> work;
        volatile ScheduledFuture<?> timeout;

        Dispatch(Subtask subtask, String serviceKey, Strategy strategy, int attemptNumber, Instant startedAt) {
            this.subtask = subtask;
            this.serviceKey = serviceKey;
            this.strategy = strategy;
            this.attemptNumber = attemptNumber;
            this.startedAt = startedAt;
        }

        boolean report(TaskRun run, Outcome outcome) {
            if (reported.compareAndSet(false, true)) {
                run.events.offer(new Event(this, outcome));
                return true;
            }
            return false;
        }

        /**
         * Give up on the attempt without reporting it.
         *
         * @return true if no outcome had been reported yet
         */
        boolean abandon() {
            if (reported.compareAndSet(false, true)) {
                ScheduledFuture<?> t = timeout;
                if (t != null) {
                    t.cancel(false);
                }
                return true;
            }
            return false;
        }
    }

    /**
     * What came back from a dispatch.
     */
    record Outcome(
        boolean success,
        JsonNode payload,
        List<String> touchedTargets,
        String errorCode,
        String errorMessage,
        boolean permanent,
        Instant completedAt
    ) {
        static Outcome of(WorkerResult result, Instant completedAt) {
            if (result.success()) {
                return new Outcome(true, result.payload(), result.touchedTargets(), null, null, false, completedAt);
            }
            return new Outcome(false, result.payload(), List.of(),
                result.errorCode() != null ? result.errorCode() : "WORKER_FAILURE",
                result.error(), false, completedAt);
        }

        static Outcome of(WorkerException e, Instant completedAt) {
            return new Outcome(false, null, List.of(), e.getErrorCode(), e.getMessage(), !e.isRetryable(), completedAt);
        }

        static Outcome crashed(RuntimeException e, Instant completedAt) {
            return new Outcome(false, null, List.of(), TaskOrchestrator.ERROR_WORKER_CRASH,
                e.getClass().getSimpleName() + ": " + e.getMessage(), false, completedAt);
        }

        static Outcome timedOut(long timeoutMillis, Instant completedAt) {
            return new Outcome(false, null, List.of(), TaskOrchestrator.ERROR_TIMEOUT,
                "worker timed out after " + timeoutMillis + "ms", false, completedAt);
        }
    }
}
