package com.agentflow.api.config;

import com.agentflow.advisory.AdvisoryService;
import com.agentflow.advisory.HistoryAdvisoryService;
import com.agentflow.api.config.AgentflowProperties.OrchestratorProps;
import com.agentflow.api.config.AgentflowProperties.WorkerProps;
import com.agentflow.core.repository.PipelineStateRepository;
import com.agentflow.engine.decomposition.ComplexityClassifier;
import com.agentflow.engine.decomposition.Decomposer;
import com.agentflow.engine.decomposition.TaskDecomposer;
import com.agentflow.engine.event.LoggingPipelineEventPublisher;
import com.agentflow.engine.health.PipelineHealthIndicator;
import com.agentflow.engine.metrics.PipelineMetrics;
import com.agentflow.engine.orchestrator.OrchestratorConfig;
import com.agentflow.engine.orchestrator.OrchestratorContext;
import com.agentflow.engine.orchestrator.TaskOrchestrator;
import com.agentflow.engine.persistence.InMemoryPipelineStateRepository;
import com.agentflow.engine.persistence.JsonFilePipelineStateRepository;
import com.agentflow.engine.tracker.FailureClassifier;
import com.agentflow.engine.tracker.PipelineStateTracker;
import com.agentflow.recovery.PipelineRecoveryEngine;
import com.agentflow.resilience.ResilienceGovernor;
import com.agentflow.worker.CapabilityRegistry;
import com.agentflow.worker.HttpWorker;
import com.agentflow.worker.WorkerRegistration;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Builds the capability registry, governor, persistence and orchestrator from
 * {@link AgentflowProperties}. The registry is built once here and never changes afterwards.
 */
@Configuration
@EnableConfigurationProperties(AgentflowProperties.class)
public class OrchestratorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CapabilityRegistry capabilityRegistry(AgentflowProperties properties, ObjectMapper objectMapper) {
        CapabilityRegistry registry = new CapabilityRegistry();
        for (WorkerProps worker : properties.getWorkers()) {
            HttpWorker backend = new HttpWorker(worker.getEndpoint(), objectMapper, worker.getRequestTimeout());
            registry.register(new WorkerRegistration(
                worker.getCapability(), worker.getServiceKey(), backend, worker.getSlots()));
        }
        if (registry.capabilities().isEmpty()) {
            log.warn("No workers configured under agentflow.workers; every subtask will fail without dispatch");
        }
        return registry;
    }

    @Bean
    public OrchestratorConfig orchestratorConfig(AgentflowProperties properties) {
        OrchestratorProps props = properties.getOrchestrator();
        return OrchestratorConfig.builder()
            .maxParallelism(props.getMaxParallelism())
            .subtaskTimeout(props.getSubtaskTimeout())
            .maxRetries(props.getMaxRetries())
            .strategyOrder(props.getStrategyOrder())
            .maxDescriptionLength(props.getMaxDescriptionLength())
            .completionPolicy(props.getCompletionPolicy())
            .defaultServicePolicy(properties.getDefaultPolicy().toPolicy())
            .maxFanOut(props.getMaxFanOut())
            .stallThreshold(props.getStallThreshold())
            .verdictCacheSize(props.getVerdictCacheSize())
            .build();
    }

    @Bean
    public ResilienceGovernor resilienceGovernor(
            AgentflowProperties properties, OrchestratorConfig config, Clock clock) {
        ResilienceGovernor governor = new ResilienceGovernor(config.defaultServicePolicy(), clock);
        properties.getServices().forEach((serviceKey, policy) -> governor.configure(serviceKey, policy.toPolicy()));
        return governor;
    }

    @Bean
    public PipelineStateRepository pipelineStateRepository(AgentflowProperties properties) {
        String snapshotDir = properties.getPersistence().getSnapshotDir();
        if (snapshotDir == null || snapshotDir.isBlank()) {
            log.info("No snapshot directory configured, pipelines are kept in memory only");
            return new InMemoryPipelineStateRepository();
        }
        log.info("Persisting pipeline snapshots to {}", snapshotDir);
        return new JsonFilePipelineStateRepository(Path.of(snapshotDir));
    }

    @Bean
    public Decomposer decomposer(OrchestratorConfig config) {
        return new TaskDecomposer(new ComplexityClassifier(), config.maxFanOut());
    }

    @Bean
    public PipelineMetrics pipelineMetrics(MeterRegistry meterRegistry) {
        return new PipelineMetrics(meterRegistry);
    }

    @Bean(destroyMethod = "shutdown")
    public TaskOrchestrator taskOrchestrator(
            CapabilityRegistry registry,
            OrchestratorConfig config,
            Clock clock,
            ResilienceGovernor governor,
            PipelineStateRepository repository,
            Decomposer decomposer,
            PipelineMetrics metrics) {
        PipelineStateTracker tracker = new PipelineStateTracker(
            repository, new FailureClassifier(), config.retryPolicy(), clock);
        OrchestratorContext context = OrchestratorContext.builder(registry)
            .config(config)
            .clock(clock)
            .governor(governor)
            .tracker(tracker)
            .decomposer(decomposer)
            .metrics(metrics)
            .eventPublisher(new LoggingPipelineEventPublisher())
            .build();
        return new TaskOrchestrator(context);
    }

    @Bean
    public PipelineHealthIndicator pipelineHealthIndicator(ResilienceGovernor governor, TaskOrchestrator orchestrator) {
        return new PipelineHealthIndicator(governor, orchestrator);
    }

    @Bean
    public AdvisoryService advisoryService(PipelineStateRepository repository, Decomposer decomposer) {
        return new HistoryAdvisoryService(repository, decomposer);
    }

    @Bean
    @ConditionalOnProperty(prefix = "agentflow.recovery", name = "enabled", havingValue = "true", matchIfMissing = true)
    public RecoveryLifecycle recoveryLifecycle(
            TaskOrchestrator orchestrator, PipelineStateRepository repository, AgentflowProperties properties) {
        return new RecoveryLifecycle(new PipelineRecoveryEngine(
            orchestrator, repository, properties.getRecovery().getStallCheckInterval()));
    }

    /**
     * Runs recovery once the context is up and stops the stall sweep before the orchestrator shuts down.
     */
    public static class RecoveryLifecycle implements SmartLifecycle {

        private final PipelineRecoveryEngine engine;

        RecoveryLifecycle(PipelineRecoveryEngine engine) {
            this.engine = engine;
        }

        @Override
        public void start() {
            engine.start();
        }

        @Override
        public void stop() {
            engine.stop();
        }

        @Override
        public boolean isRunning() {
            return engine.isRunning();
        }

        public PipelineRecoveryEngine engine() {
            return engine;
        }
    }
}
