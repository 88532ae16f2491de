package com.agentflow.engine.metrics;

import com.agentflow.core.model.AgentAttempt;
import com.agentflow.core.model.TaskStage;
import com.agentflow.resilience.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics for the orchestration pipeline.
 *
 * Metrics exposed:
 * - Tasks submitted and finished, by terminal stage
 * - Attempts by strategy and outcome, attempt duration
 * - Admission deferrals by service key
 * - Circuit transitions by service key and target state
 * - In-flight dispatches and active pipelines
 */
public class PipelineMetrics implements MeterBinder {

    // Metric names
    public static final String TASKS_SUBMITTED = "agentflow.tasks.submitted";
    public static final String TASKS_FINISHED = "agentflow.tasks.finished";
    public static final String ATTEMPTS = "agentflow.attempts";
    public static final String ATTEMPT_DURATION = "agentflow.attempt.duration";
    public static final String ADMISSION_DEFERRALS = "agentflow.admission.deferrals";
    public static final String CIRCUIT_TRANSITIONS = "agentflow.circuit.transitions";
    public static final String IN_FLIGHT = "agentflow.dispatch.in_flight";
    public static final String ACTIVE_PIPELINES = "agentflow.pipelines.active";
    public static final String RESUMED_PIPELINES = "agentflow.pipelines.resumed";

    private final MeterRegistry registry;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger activePipelines = new AtomicInteger();

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder(IN_FLIGHT, inFlight, AtomicInteger::get)
            .description("Subtask dispatches currently running")
            .register(registry);
        Gauge.builder(ACTIVE_PIPELINES, activePipelines, AtomicInteger::get)
            .description("Pipelines submitted and not yet terminal")
            .register(registry);
    }

    // ========== Task Metrics ==========

    public void taskSubmitted() {
        Counter.builder(TASKS_SUBMITTED)
            .description("Total tasks accepted")
            .register(registry)
            .increment();
        activePipelines.incrementAndGet();
    }

    public void taskFinished(TaskStage stage) {
        Counter.builder(TASKS_FINISHED)
            .tag("stage", stage.name())
            .description("Total tasks reaching a terminal stage")
            .register(registry)
            .increment();
        activePipelines.decrementAndGet();
    }

    public void pipelineResumed() {
        Counter.builder(RESUMED_PIPELINES)
            .description("Pipelines resumed from a persisted snapshot")
            .register(registry)
            .increment();
        activePipelines.incrementAndGet();
    }

    // ========== Dispatch Metrics ==========

    public void dispatchStarted() {
        inFlight.incrementAndGet();
    }

    /**
     * A dispatch left the in-flight set, whether or not its outcome gets recorded.
     */
    public void dispatchFinished() {
        inFlight.decrementAndGet();
    }

    public void attemptRecorded(AgentAttempt attempt) {
        String classification = attempt.errorClassification() != null
            ? attempt.errorClassification().value()
            : "none";
        Counter.builder(ATTEMPTS)
            .tag("strategy", attempt.strategy().value())
            .tag("outcome", attempt.outcome().name())
            .tag("classification", classification)
            .description("Worker attempts recorded")
            .register(registry)
            .increment();
        Timer.builder(ATTEMPT_DURATION)
            .tag("strategy", attempt.strategy().value())
            .tag("outcome", attempt.outcome().name())
            .description("Worker attempt duration")
            .register(registry)
            .record(attempt.duration());
    }

    public void admissionDeferred(String serviceKey) {
        Counter.builder(ADMISSION_DEFERRALS)
            .tag("service", serviceKey)
            .description("Dispatches deferred by the resilience governor")
            .register(registry)
            .increment();
    }

    public void circuitTransition(String serviceKey, CircuitState to) {
        Counter.builder(CIRCUIT_TRANSITIONS)
            .tag("service", serviceKey)
            .tag("state", to.name())
            .description("Circuit breaker state changes")
            .register(registry)
            .increment();
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int activePipelines() {
        return activePipelines.get();
    }
}
