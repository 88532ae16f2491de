package com.agentflow.engine.orchestrator;

import com.agentflow.core.repository.PipelineStateRepository;
import com.agentflow.engine.decomposition.ComplexityClassifier;
import com.agentflow.engine.decomposition.Decomposer;
import com.agentflow.engine.decomposition.TaskDecomposer;
import com.agentflow.engine.event.LoggingPipelineEventPublisher;
import com.agentflow.engine.event.PipelineEventPublisher;
import com.agentflow.engine.metrics.PipelineMetrics;
import com.agentflow.engine.persistence.InMemoryPipelineStateRepository;
import com.agentflow.engine.tracker.FailureClassifier;
import com.agentflow.engine.tracker.PipelineStateTracker;
import com.agentflow.resilience.ResilienceGovernor;
import com.agentflow.worker.CapabilityRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.util.Objects;

/**
 * Everything one orchestrator instance depends on, passed in explicitly.
 * Two orchestrators built from separate contexts share nothing.
 */
public record OrchestratorContext(
    OrchestratorConfig config,
    Clock clock,
    ResilienceGovernor governor,
    CapabilityRegistry registry,
    PipelineStateTracker tracker,
    Decomposer decomposer,
    PipelineMetrics metrics,
    PipelineEventPublisher eventPublisher
) {
    public OrchestratorContext {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(governor, "governor");
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(tracker, "tracker");
        Objects.requireNonNull(decomposer, "decomposer");
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(eventPublisher, "eventPublisher");
    }

    public static Builder builder(CapabilityRegistry registry) {
        return new Builder(registry);
    }

    /**
     * Fills in whatever is not set: system UTC clock, a governor with the config's default
     * service policy, an in-memory repository, the heuristic decomposer, metrics on a
     * simple registry and a logging event publisher.
     */
    public static class Builder {
        private final CapabilityRegistry registry;
        private OrchestratorConfig config = OrchestratorConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private ResilienceGovernor governor;
        private PipelineStateRepository repository;
        private PipelineStateTracker tracker;
        private Decomposer decomposer;
        private PipelineMetrics metrics;
        private PipelineEventPublisher eventPublisher;

        private Builder(CapabilityRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
        }

        public Builder config(OrchestratorConfig config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder governor(ResilienceGovernor governor) {
            this.governor = governor;
            return this;
        }

        public Builder repository(PipelineStateRepository repository) {
            this.repository = repository;
            return this;
        }

        public Builder tracker(PipelineStateTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        public Builder decomposer(Decomposer decomposer) {
            this.decomposer = decomposer;
            return this;
        }

        public Builder metrics(PipelineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder eventPublisher(PipelineEventPublisher eventPublisher) {
            this.eventPublisher = eventPublisher;
            return this;
        }

        public OrchestratorContext build() {
            ResilienceGovernor g = governor != null
                ? governor
                : new ResilienceGovernor(config.defaultServicePolicy(), clock);
            PipelineStateTracker t = tracker != null
                ? tracker
                : new PipelineStateTracker(
                    repository != null ? repository : new InMemoryPipelineStateRepository(),
                    new FailureClassifier(), config.retryPolicy(), clock);
            Decomposer d = decomposer != null
                ? decomposer
                : new TaskDecomposer(new ComplexityClassifier(), config.maxFanOut());
            PipelineMetrics m = metrics != null ? metrics : new PipelineMetrics(new SimpleMeterRegistry());
            PipelineEventPublisher p = eventPublisher != null ? eventPublisher : new LoggingPipelineEventPublisher();
            return new OrchestratorContext(config, clock, g, registry, t, d, m, p);
        }
    }
}
