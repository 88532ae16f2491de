package com.agentflow.engine.orchestrator;

import com.agentflow.core.exception.CorruptStateException;
import com.agentflow.core.exception.GraphValidationException;
import com.agentflow.core.exception.InvalidTaskException;
import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.model.AgentAttempt;
import com.agentflow.core.model.CompletionPolicy;
import com.agentflow.core.model.EscalationRecord;
import com.agentflow.core.model.PipelineState;
import com.agentflow.core.model.StageTransition;
import com.agentflow.core.model.Strategy;
import com.agentflow.core.model.Subtask;
import com.agentflow.core.model.SubtaskGraph;
import com.agentflow.core.model.SubtaskStatus;
import com.agentflow.core.model.Task;
import com.agentflow.core.model.TaskStage;
import com.agentflow.core.model.Verdict;
import com.agentflow.engine.event.ReadyForIntegrationEvent;
import com.agentflow.engine.logging.LoggingContext;
import com.agentflow.engine.orchestrator.TaskRun.Dispatch;
import com.agentflow.engine.orchestrator.TaskRun.Event;
import com.agentflow.engine.orchestrator.TaskRun.Outcome;
import com.agentflow.engine.orchestrator.TaskRun.Parking;
import com.agentflow.engine.tracker.FailureClassifier;
import com.agentflow.engine.tracker.PipelineStateTracker;
import com.agentflow.worker.Worker;
import com.agentflow.worker.WorkerException;
import com.agentflow.worker.WorkerRegistration;
import com.agentflow.worker.WorkerRequest;
import com.agentflow.worker.WorkerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Turns submitted tasks into executed subtask graphs and terminal verdicts.
 *
 * Execution model:
 * - The thread calling {@link #execute(String)} coordinates its pipeline: it promotes
 *   subtasks whose dependencies succeeded, dispatches them and consumes their outcomes
 *   from a queue. Nothing but that thread changes the pipeline's subtask statuses.
 * - Worker calls run on a shared pool. A semaphore caps concurrently running subtasks
 *   across all pipelines of this orchestrator.
 * - Every dispatch passes admission control first. A refusal parks the subtask with
 *   exponential backoff and is never counted as an attempt.
 * - Each attempt has a timeout; whichever of the worker and the timeout reports first wins.
 *
 * Failure policy: a failed attempt is retried with the next strategy from the tracker.
 * When none is left the subtask fails terminally; its descendants are skipped, and when
 * other unfinished subtasks depend on it the whole task escalates (or fails, for a
 * permanent worker error). Failures off the critical path are handled by the configured
 * {@link CompletionPolicy}.
 */
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    public static final String ERROR_TIMEOUT = FailureClassifier.TIMEOUT_CODE;
    public static final String ERROR_WORKER_CRASH = "WORKER_CRASH";
    public static final String ERROR_NO_WORKER = "NO_WORKER";
    public static final String ERROR_EMPTY_RESULT = "EMPTY_RESULT";

    private static final Pattern TASK_ID_PATTERN = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    private static final long IDLE_POLL_MILLIS = 500;

    private final OrchestratorContext context;
    private final OrchestratorConfig config;
    private final PipelineStateTracker tracker;
    private final int parallelism;
    private final Semaphore slots;
    private final ExecutorService coordinatorPool;
    private final ExecutorService workerPool;
    private final ScheduledExecutorService timeoutScheduler;
    private final Map<String, TaskRun> runs = new ConcurrentHashMap<>();
    private final VerdictCache verdicts;

    public TaskOrchestrator(OrchestratorContext context) {
        this.context = context;
        this.config = context.config();
        this.verdicts = new VerdictCache(config.verdictCacheSize());
        this.tracker = context.tracker();
        this.parallelism = config.maxParallelism() > 0
            ? config.maxParallelism()
            : Math.max(1, context.registry().totalSlots());
        this.slots = new Semaphore(parallelism);
        this.coordinatorPool = Executors.newCachedThreadPool();
        this.workerPool = Executors.newCachedThreadPool();
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor();
        context.governor().addListener((serviceKey, from, to) -> context.metrics().circuitTransition(serviceKey, to));
        log.info("Task orchestrator ready: parallelism={}, timeout={}, maxRetries={}, policy={}",
            parallelism, config.subtaskTimeout(), config.retryPolicy().maxRetries(), config.completionPolicy());
    }

    // ========== Submission ==========

    /**
     * Accept a task and create its pipeline at stage SUBMITTED.
     * Submitting an id whose pipeline is still active returns that pipeline.
     *
     * @return the pipeline id, which is the task id
     * @throws InvalidTaskException if the description is empty or too long, or the id is
     *         unusable; no state is created in that case
     */
    public String submit(TaskSubmission submission) {
        String description = submission.description();
        String requestedId = submission.taskId();
        if (description == null || description.isBlank()) {
            throw new InvalidTaskException("description must not be empty");
        }
        if (description.length() > config.maxDescriptionLength()) {
            throw new InvalidTaskException(String.format(
                "description is %d characters, limit is %d", description.length(), config.maxDescriptionLength()));
        }

        if (requestedId != null && !requestedId.isBlank()) {
            if (!TASK_ID_PATTERN.matcher(requestedId).matches() || requestedId.contains("..")) {
                throw new InvalidTaskException(requestedId,
                    "task id may only contain letters, digits, '.', '_' and '-', and must not contain '..'");
            }
            if (runs.containsKey(requestedId)) {
                log.info("Task {} already active, returning existing pipeline", requestedId);
                return requestedId;
            }
            Optional<PipelineState> persisted;
            try {
                persisted = tracker.find(requestedId);
            } catch (CorruptStateException e) {
                throw new InvalidTaskException(requestedId,
                    "stored pipeline for this id is corrupt; resubmit under a new id");
            }
            if (persisted.isPresent()) {
                if (!persisted.get().isTerminal()) {
                    return resume(requestedId);
                }
                throw new InvalidTaskException(requestedId,
                    "a pipeline for this id already finished at stage " + persisted.get().stage());
            }
        }

        Task task = Task.create(requestedId, description, submission.declaredComplexity(), context.clock().instant());
        TaskRun run = new TaskRun(task, false);
        TaskRun prior = runs.putIfAbsent(task.taskId(), run);
        if (prior != null) {
            return prior.taskId();
        }
        tracker.begin(task);
        context.metrics().taskSubmitted();
        log.info("Accepted task {} ({} characters{})", task.taskId(), description.length(),
            task.declaredComplexity() != null ? ", declared " + task.declaredComplexity() : "");
        return task.taskId();
    }

    /**
     * Classify a task and build its subtask graph. Pure with respect to pipeline state.
     */
    public SubtaskGraph decompose(Task task) {
        return context.decomposer().decompose(task);
    }

    // ========== Execution ==========

    /**
     * Run a pipeline to its terminal verdict on the calling thread.
     * Calling it again, or concurrently, returns the same verdict without re-running anything.
     *
     * @throws NotFoundException if no pipeline exists for the id
     */
    public Verdict execute(String pipelineId) {
        Verdict done = verdicts.get(pipelineId);
        if (done != null) {
            return done;
        }
        TaskRun run = runs.get(pipelineId);
        if (run == null) {
            return verdict(pipelineId).orElseThrow(() -> new NotFoundException("Pipeline", pipelineId));
        }
        if (!run.claim()) {
            return run.verdict.join();
        }
        return runToCompletion(run);
    }

    public CompletableFuture<Verdict> executeAsync(String pipelineId) {
        return CompletableFuture.supplyAsync(() -> execute(pipelineId), coordinatorPool);
    }

    /**
     * Cancel a pipeline. Subtasks not yet started are skipped; running ones finish and
     * their outcomes are recorded.
     *
     * @return false if the pipeline had already finished or a cancellation was already requested
     * @throws NotFoundException if no pipeline exists for the id
     */
    public boolean cancel(String pipelineId, String reason) {
        TaskRun run = runs.get(pipelineId);
        if (run == null) {
            if (verdicts.contains(pipelineId) || tracker.find(pipelineId).isPresent()) {
                return false;
            }
            throw new NotFoundException("Pipeline", pipelineId);
        }
        if (!run.requestCancel(reason != null ? reason : "cancelled")) {
            return false;
        }
        log.info("Cancellation requested for task {}: {}", pipelineId, run.cancelReason);
        if (run.claim()) {
            // Never started executing; finish it here
            runToCompletion(run);
        }
        return true;
    }

    public boolean cancel(String pipelineId) {
        return cancel(pipelineId, "cancelled by request");
    }

    /**
     * Re-register a persisted, unfinished pipeline so it can be executed again.
     * The graph is re-derived from the task; subtasks keep the outcomes and strategies
     * recorded before the restart.
     *
     * @throws CorruptStateException if the persisted history cannot be trusted
     * @throws NotFoundException if nothing was persisted for the id
     */
    public String resume(String taskId) {
        if (runs.containsKey(taskId)) {
            return taskId;
        }
        PipelineState state = tracker.load(taskId);
        if (state.isTerminal()) {
            verdicts.getOrLoad(taskId, () -> verdictFromHistory(state));
            return taskId;
        }
        TaskRun run = new TaskRun(state.task(), true);
        if (runs.putIfAbsent(taskId, run) == null) {
            context.metrics().pipelineResumed();
            log.info("Resumed task {} at stage {} with {} recorded attempts",
                taskId, state.stage(), state.attempts().size());
        }
        return taskId;
    }

    // ========== Queries ==========

    public PipelineState state(String pipelineId) {
        return tracker.state(pipelineId);
    }

    public Optional<Verdict> verdict(String pipelineId) {
        Verdict done = verdicts.get(pipelineId);
        if (done != null) {
            return Optional.of(done);
        }
        return tracker.find(pipelineId)
            .filter(PipelineState::isTerminal)
            .map(state -> verdicts.getOrLoad(pipelineId, () -> verdictFromHistory(state)));
    }

    public Optional<SubtaskGraph> graph(String pipelineId) {
        TaskRun run = runs.get(pipelineId);
        return run != null ? Optional.ofNullable(run.graph) : Optional.empty();
    }

    public Set<String> activePipelineIds() {
        return Set.copyOf(runs.keySet());
    }

    public boolean isActive(String pipelineId) {
        return runs.containsKey(pipelineId);
    }

    /**
     * @return number of finished verdicts currently held in memory
     */
    public int cachedVerdictCount() {
        return verdicts.size();
    }

    public int parallelism() {
        return parallelism;
    }

    public OrchestratorContext context() {
        return context;
    }

    // ========== Pipeline driver ==========

    private Verdict runToCompletion(TaskRun run) {
        String taskId = run.taskId();
        Verdict verdict;
        try (LoggingContext ctx = LoggingContext.forTask(taskId)) {
            verdict = drive(run);
        } catch (RuntimeException e) {
            log.error("Pipeline {} aborted by unexpected error", taskId, e);
            verdict = abort(run, e);
        }
        verdicts.put(taskId, verdict);
        runs.remove(taskId);
        run.verdict.complete(verdict);
        return verdict;
    }

    private Verdict drive(TaskRun run) {
        String taskId = run.taskId();
        if (run.isCancelRequested()) {
            run.cancelApplied = true;
            return finish(run);
        }

        if (tracker.state(taskId).stage() == TaskStage.SUBMITTED) {
            tracker.transition(taskId, TaskStage.ROUTING, "classifying and decomposing");
        }
        SubtaskGraph graph;
        try {
            graph = decompose(run.task);
        } catch (GraphValidationException e) {
            log.error("Decomposition of task {} produced an invalid graph: {}", taskId, e.getViolations());
            run.halt(TaskStage.FAILED, null, "decomposition failed: " + e.getMessage());
            return finish(run);
        }
        run.graph = graph;
        if (run.resumed) {
            restoreStatuses(run);
        }
        if (tracker.state(taskId).stage() == TaskStage.ROUTING) {
            tracker.transition(taskId, TaskStage.IMPLEMENTING, String.format(
                "%s decomposition into %d subtasks (%s)", graph.tier(), graph.size(), graph.pattern()));
        }

        boolean interrupted = false;
        while (true) {
            if (run.isCancelRequested() && !run.cancelApplied) {
                run.cancelApplied = true;
                run.parked.clear();
                run.skippedByCancel.addAll(graph.skipNotStarted());
                log.info("Task {} cancelled: skipped {}, waiting for {} in flight",
                    taskId, run.skippedByCancel, run.inFlight.size());
            }
            if (!run.isHalted() && !run.cancelApplied) {
                dispatchReady(run);
            }
            if (run.inFlight.isEmpty()) {
                if (graph.allTerminal()) {
                    break;
                }
                if (graph.withStatus(SubtaskStatus.READY).isEmpty()) {
                    List<String> unreachable = graph.skipNotStarted();
                    log.warn("Task {} has subtasks that can never run, skipped: {}", taskId, unreachable);
                    break;
                }
            }

            long waitMillis = run.nextWakeMillis(IDLE_POLL_MILLIS, System.nanoTime());
            Event event;
            try {
                event = run.events.poll(waitMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                interrupted = true;
                run.requestCancel("coordinator interrupted");
                continue;
            }
            while (event != null) {
                if (!event.isWake()) {
                    handleOutcome(run, event.dispatch(), event.outcome());
                }
                event = run.events.poll();
            }
        }

        Verdict verdict = finish(run);
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return verdict;
    }

    private void dispatchReady(TaskRun run) {
        SubtaskGraph graph = run.graph;
        graph.promoteReady();
        run.waitingForSlot = false;
        long nowNanos = System.nanoTime();

        for (Subtask subtask : graph.withStatus(SubtaskStatus.READY)) {
            String subtaskId = subtask.subtaskId();
            Parking parking = run.parked.get(subtaskId);
            if (parking != null && parking.untilNanos() - nowNanos > 0) {
                continue;
            }
            if (run.conflictsWithInFlight(subtask)) {
                log.debug("Holding {}: a running subtask touches the same targets", subtaskId);
                continue;
            }

            WorkerRegistration registration;
            try {
                registration = context.registry().resolve(subtask.capability());
            } catch (NotFoundException e) {
                run.permanentFailures.add(subtaskId);
                failWithoutDispatch(run, subtask, true,
                    ERROR_NO_WORKER + ": no worker registered for capability " + subtask.capability());
                continue;
            }

            Strategy strategy = run.plannedStrategies.get(subtaskId);
            if (strategy == null) {
                Optional<Strategy> next = tracker.nextStrategy(run.taskId(), subtaskId);
                if (next.isEmpty()) {
                    failWithoutDispatch(run, subtask, false, "retries exhausted for " + subtaskId);
                    continue;
                }
                strategy = next.get();
            }

            if (!slots.tryAcquire()) {
                run.waitingForSlot = true;
                return;
            }
            if (!context.governor().admit(registration.serviceKey())) {
                slots.release();
                int deferrals = parking != null ? parking.deferrals() + 1 : 1;
                Duration delay = config.admissionBackoff().computeBackoff(deferrals);
                run.parked.put(subtaskId, new Parking(deferrals, nowNanos + delay.toNanos()));
                context.metrics().admissionDeferred(registration.serviceKey());
                log.debug("Admission refused for {} on {}, deferral {}, retry in {}ms",
                    subtaskId, registration.serviceKey(), deferrals, delay.toMillis());
                continue;
            }

            run.parked.remove(subtaskId);
            run.plannedStrategies.remove(subtaskId);
            advanceStageFor(run, subtask);
            graph.transition(subtaskId, SubtaskStatus.RUNNING);
            launch(run, subtask, registration, strategy);
        }
    }

    private void launch(TaskRun run, Subtask subtask, WorkerRegistration registration, Strategy strategy) {
        PipelineState state = tracker.state(run.taskId());
        String subtaskId = subtask.subtaskId();
        int attemptNumber = state.nextAttemptNumber(subtaskId);
        WorkerRequest request = new WorkerRequest(subtask, strategy, attemptNumber, state.attemptsFor(subtaskId));
        Dispatch dispatch = new Dispatch(subtask, registration.serviceKey(), strategy, attemptNumber,
            context.clock().instant());
        run.inFlight.put(subtaskId, dispatch);
        context.metrics().dispatchStarted();
        log.info("Dispatching {} attempt {} [{}] to {}",
            subtaskId, attemptNumber, strategy.value(), registration.serviceKey());

        String traceId = LoggingContext.getTraceId();
        Worker worker = registration.worker();
        dispatch.work = workerPool.submit(() -> invoke(run, dispatch, worker, request, traceId));
        long timeoutMillis = config.subtaskTimeout().toMillis();
        dispatch.timeout = timeoutScheduler.schedule(() -> {
            if (dispatch.report(run, Outcome.timedOut(timeoutMillis, context.clock().instant()))) {
                log.warn("Attempt {} of {} timed out after {}ms", attemptNumber, subtaskId, timeoutMillis);
                dispatch.work.cancel(true);
            }
        }, timeoutMillis, TimeUnit.MILLISECONDS);
    }

    private void invoke(TaskRun run, Dispatch dispatch, Worker worker, WorkerRequest request, String traceId) {
        try (LoggingContext ctx = LoggingContext.forSubtask(request.getTaskId(), request.getSubtaskId(),
                request.getAttemptNumber(), request.getStrategy().value(), dispatch.serviceKey)) {
            if (traceId != null) {
                MDC.put(LoggingContext.TRACE_ID, traceId);
            }
            WorkerResult result = worker.execute(request);
            if (result == null) {
                result = WorkerResult.failure(ERROR_EMPTY_RESULT, "worker returned no result");
            }
            dispatch.report(run, Outcome.of(result, context.clock().instant()));
        } catch (WorkerException e) {
            dispatch.report(run, Outcome.of(e, context.clock().instant()));
        } catch (RuntimeException e) {
            log.error("Worker for {} threw unexpectedly", request.getSubtaskId(), e);
            dispatch.report(run, Outcome.crashed(e, context.clock().instant()));
        } finally {
            LoggingContext.clearAll();
        }
    }

    private void handleOutcome(TaskRun run, Dispatch dispatch, Outcome outcome) {
        String taskId = run.taskId();
        String subtaskId = dispatch.subtask.subtaskId();
        run.inFlight.remove(subtaskId);
        context.metrics().dispatchFinished();
        if (dispatch.timeout != null) {
            dispatch.timeout.cancel(false);
        }
        releaseSlot();
        context.governor().record(dispatch.serviceKey, outcome.success(), dispatch.startedAt);

        Instant completedAt = outcome.completedAt().isBefore(dispatch.startedAt)
            ? dispatch.startedAt
            : outcome.completedAt();
        AgentAttempt attempt = outcome.success()
            ? AgentAttempt.success(subtaskId, dispatch.attemptNumber, dispatch.strategy,
                dispatch.startedAt, completedAt, outcome.payload(), outcome.touchedTargets())
            : AgentAttempt.failure(subtaskId, dispatch.attemptNumber, dispatch.strategy,
                dispatch.startedAt, completedAt, outcome.errorCode(), outcome.errorMessage(), outcome.payload());
        AgentAttempt recorded = tracker.recordAttempt(taskId, attempt);
        context.metrics().attemptRecorded(recorded);

        SubtaskGraph graph = run.graph;
        if (recorded.isSuccess()) {
            graph.transition(subtaskId, SubtaskStatus.SUCCEEDED);
            return;
        }

        log.warn("Attempt {} of {} failed [{}]: {} ({})", recorded.attemptNumber(), subtaskId,
            recorded.strategy().value(), recorded.errorClassification().value(), recorded.errorMessage());

        if (run.cancelApplied || run.isHalted()) {
            graph.transition(subtaskId, SubtaskStatus.FAILED);
            run.degraded.add(subtaskId);
            return;
        }

        boolean permanent = outcome.permanent() || !tracker.retryPolicy().shouldRetry(outcome.errorCode());
        Optional<Strategy> next = permanent ? Optional.empty() : tracker.nextStrategy(taskId, subtaskId);
        if (next.isPresent()) {
            graph.transition(subtaskId, SubtaskStatus.READY);
            run.plannedStrategies.put(subtaskId, next.get());
            log.info("Retrying {} with strategy {} (retry {}/{})", subtaskId, next.get().value(),
                tracker.retryCount(taskId), tracker.state(taskId).maxRetries());
            return;
        }

        graph.transition(subtaskId, SubtaskStatus.FAILED);
        String reason;
        if (permanent) {
            run.permanentFailures.add(subtaskId);
            reason = String.format("permanent worker error on %s: %s %s",
                subtaskId, outcome.errorCode(), outcome.errorMessage());
        } else {
            reason = String.format("retries exhausted on %s after %d attempts (last failure: %s)",
                subtaskId, recorded.attemptNumber(), recorded.errorClassification().value());
        }
        onTerminalFailure(run, subtaskId, permanent, reason);
    }

    private void failWithoutDispatch(TaskRun run, Subtask subtask, boolean permanent, String reason) {
        SubtaskGraph graph = run.graph;
        graph.transition(subtask.subtaskId(), SubtaskStatus.RUNNING);
        graph.transition(subtask.subtaskId(), SubtaskStatus.FAILED);
        run.parked.remove(subtask.subtaskId());
        log.warn("Subtask {} failed without dispatch: {}", subtask.subtaskId(), reason);
        onTerminalFailure(run, subtask.subtaskId(), permanent, reason);
    }

    /**
     * Apply the failure policy to a subtask that failed for good.
     */
    private void onTerminalFailure(TaskRun run, String subtaskId, boolean permanent, String reason) {
        SubtaskGraph graph = run.graph;
        boolean critical = config.completionPolicy() == CompletionPolicy.ALL_OR_NOTHING
            || graph.isCriticalPath(subtaskId);
        List<String> skipped = graph.skipDescendants(subtaskId);
        if (!skipped.isEmpty()) {
            log.info("Skipping descendants of {}: {}", subtaskId, skipped);
        }

        if (critical) {
            run.halt(permanent ? TaskStage.FAILED : TaskStage.ESCALATED, subtaskId, reason);
            run.parked.clear();
            List<String> halted = graph.skipNotStarted();
            log.warn("Critical subtask {} failed, halting task {}: {}; skipped {}",
                subtaskId, run.taskId(), reason, halted);
        } else {
            run.degraded.add(subtaskId);
            log.warn("Subtask {} failed off the critical path, continuing: {}", subtaskId, reason);
        }
    }

    private void advanceStageFor(TaskRun run, Subtask subtask) {
        String taskId = run.taskId();
        TaskStage current = tracker.state(taskId).stage();
        TaskStage target = Subtask.CAPABILITY_VALIDATION.equals(subtask.capability())
            ? TaskStage.TESTING
            : TaskStage.IMPLEMENTING;
        if (target == TaskStage.TESTING && current == TaskStage.IMPLEMENTING) {
            int succeeded = run.graph.withStatus(SubtaskStatus.SUCCEEDED).size();
            tracker.transition(taskId, TaskStage.REVIEWING, String.format(
                "implementation joined: %d succeeded, %d degraded", succeeded, run.degraded.size()));
            current = TaskStage.REVIEWING;
        }
        if (current != target && current.canTransitionTo(target)) {
            tracker.transition(taskId, target, "dispatching " + subtask.subtaskId());
        }
    }

    private void restoreStatuses(TaskRun run) {
        SubtaskGraph graph = run.graph;
        String taskId = run.taskId();
        PipelineState state = tracker.state(taskId);
        for (String subtaskId : graph.topologicalOrder()) {
            Subtask subtask = graph.get(subtaskId);
            if (subtask.status() != SubtaskStatus.PENDING || !graph.dependenciesSucceeded(subtask)) {
                continue;
            }
            if (state.attemptsFor(subtaskId).isEmpty()) {
                continue;
            }
            graph.transition(subtaskId, SubtaskStatus.READY);
            if (state.hasSucceeded(subtaskId)) {
                graph.transition(subtaskId, SubtaskStatus.RUNNING);
                graph.transition(subtaskId, SubtaskStatus.SUCCEEDED);
                continue;
            }
            Optional<Strategy> next = tracker.nextStrategy(taskId, subtaskId);
            if (next.isPresent()) {
                run.plannedStrategies.put(subtaskId, next.get());
            } else {
                graph.transition(subtaskId, SubtaskStatus.RUNNING);
                graph.transition(subtaskId, SubtaskStatus.FAILED);
                onTerminalFailure(run, subtaskId, false, "retries exhausted on " + subtaskId + " before restart");
            }
        }
        log.info("Restored subtask statuses for task {}: {}", taskId, graph.statusSnapshot());
    }

    // ========== Verdicts ==========

    private Verdict finish(TaskRun run) {
        String taskId = run.taskId();
        SubtaskGraph graph = run.graph;
        Map<String, SubtaskStatus> statuses = graph != null ? graph.statusSnapshot() : Map.of();

        TaskStage outcome;
        String summary;
        String failedSubtaskId = run.haltSubtaskId;
        if (run.isHalted()) {
            outcome = run.haltStage;
            summary = run.haltReason;
        } else if (run.cancelApplied) {
            outcome = TaskStage.CANCELLED;
            summary = run.cancelReason + (run.skippedByCancel.isEmpty() ? "" : "; skipped " + run.skippedByCancel);
        } else {
            List<String> failed = graph.withStatus(SubtaskStatus.FAILED).stream().map(Subtask::subtaskId).toList();
            boolean deliverable = graph.sinks().stream().anyMatch(s -> s.status() == SubtaskStatus.SUCCEEDED);
            if (failed.isEmpty()) {
                outcome = TaskStage.COMPLETE;
                summary = String.format("all %d subtasks succeeded", graph.size());
            } else if (deliverable && config.completionPolicy() == CompletionPolicy.GRACEFUL_DEGRADATION) {
                outcome = TaskStage.COMPLETE;
                summary = String.format("completed with %d degraded subtasks: %s", failed.size(), failed);
            } else {
                failedSubtaskId = failed.get(0);
                boolean permanent = failed.stream().anyMatch(run.permanentFailures::contains);
                outcome = permanent ? TaskStage.FAILED : TaskStage.ESCALATED;
                summary = String.format("no deliverable subtask succeeded; failed: %s", failed);
            }
        }

        EscalationRecord escalation = null;
        if (outcome == TaskStage.ESCALATED || outcome == TaskStage.FAILED) {
            escalation = tracker.escalate(taskId, failedSubtaskId, summary);
        }
        tracker.transition(taskId, outcome, summary);
        PipelineState archived = tracker.archive(taskId);
        context.metrics().taskFinished(outcome);

        Verdict verdict = new Verdict(taskId, outcome, statuses, run.degraded,
            archived.attempts().size(), escalation, summary, context.clock().instant());
        publish(run, verdict, archived);
        log.info("Task {} finished {}: {}", taskId, outcome, summary);
        return verdict;
    }

    private void publish(TaskRun run, Verdict verdict, PipelineState state) {
        try {
            if (verdict.stage() == TaskStage.COMPLETE) {
                context.eventPublisher().onReadyForIntegration(new ReadyForIntegrationEvent(
                    run.taskId(), run.task.description(), state.touchedTargets(),
                    verdict.degradedSubtasks(), verdict.decidedAt()));
            } else if (verdict.stage() == TaskStage.ESCALATED) {
                context.eventPublisher().onEscalation(verdict.escalation());
            }
        } catch (RuntimeException e) {
            log.error("Event publisher failed for task {}", run.taskId(), e);
        }
    }

    /**
     * Best-effort terminal verdict after an unexpected error inside the driver.
     */
    private Verdict abort(TaskRun run, RuntimeException cause) {
        String taskId = run.taskId();
        for (Dispatch dispatch : run.inFlight.values()) {
            if (dispatch.abandon()) {
                context.metrics().dispatchFinished();
                releaseSlot();
            }
        }
        run.inFlight.clear();
        String summary = "internal error: " + cause.getMessage();
        EscalationRecord escalation = null;
        int attempts = 0;
        try {
            escalation = tracker.escalate(taskId, run.haltSubtaskId, summary);
            attempts = escalation.attempts().size();
            PipelineState state = tracker.state(taskId);
            if (!state.isTerminal()) {
                tracker.transition(taskId, TaskStage.FAILED, summary);
            }
            tracker.archive(taskId);
        } catch (RuntimeException e) {
            log.error("Could not record failure of task {}", taskId, e);
        }
        context.metrics().taskFinished(TaskStage.FAILED);
        Map<String, SubtaskStatus> statuses = run.graph != null ? run.graph.statusSnapshot() : Map.of();
        return new Verdict(taskId, TaskStage.FAILED, statuses, run.degraded, attempts, escalation,
            summary, context.clock().instant());
    }

    /**
     * Rebuild a verdict for a pipeline that finished before this process started.
     */
    private Verdict verdictFromHistory(PipelineState state) {
        Map<String, SubtaskStatus> statuses = new LinkedHashMap<>();
        for (AgentAttempt attempt : state.attempts()) {
            SubtaskStatus status = attempt.isSuccess() ? SubtaskStatus.SUCCEEDED : SubtaskStatus.FAILED;
            statuses.merge(attempt.subtaskId(), status,
                (previous, latest) -> previous == SubtaskStatus.SUCCEEDED ? previous : latest);
        }
        List<StageTransition> history = state.stageHistory();
        String summary = history.isEmpty() ? "" : history.get(history.size() - 1).reason();
        EscalationRecord escalation = null;
        if (state.stage() == TaskStage.ESCALATED || state.stage() == TaskStage.FAILED) {
            escalation = tracker.escalate(state.taskId(), null, summary);
        }
        List<String> degraded = new ArrayList<>();
        if (state.stage() == TaskStage.COMPLETE) {
            statuses.forEach((id, status) -> {
                if (status == SubtaskStatus.FAILED) {
                    degraded.add(id);
                }
            });
        }
        Instant decidedAt = state.archivedAt() != null ? state.archivedAt() : state.updatedAt();
        return new Verdict(state.taskId(), state.stage(), statuses, degraded, state.attempts().size(),
            escalation, summary, decidedAt);
    }

    private void releaseSlot() {
        slots.release();
        for (TaskRun other : runs.values()) {
            if (other.waitingForSlot) {
                other.wake();
            }
        }
    }

    // ========== Lifecycle ==========

    /**
     * Stop accepting work and wait for running pipelines' threads to finish.
     */
    public void shutdown() {
        log.info("Shutting down task orchestrator with {} active pipelines", runs.size());
        coordinatorPool.shutdown();
        workerPool.shutdown();
        timeoutScheduler.shutdown();
        try {
            if (!coordinatorPool.awaitTermination(30, TimeUnit.SECONDS)) {
                coordinatorPool.shutdownNow();
            }
            if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
            if (!timeoutScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                timeoutScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            coordinatorPool.shutdownNow();
            workerPool.shutdownNow();
            timeoutScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
