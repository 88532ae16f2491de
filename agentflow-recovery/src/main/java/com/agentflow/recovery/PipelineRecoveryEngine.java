package com.agentflow.recovery;

import com.agentflow.core.exception.CorruptStateException;
import com.agentflow.core.model.PipelineState;
import com.agentflow.core.repository.PipelineStateRepository;
import com.agentflow.engine.orchestrator.TaskOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Recovery engine responsible for pipelines interrupted by a restart.
 *
 * Responsibilities:
 * - Reload non-terminal pipelines at start-up and resume them
 * - Report pipelines whose persisted history is corrupt; they need resubmission
 * - Detect stalled pipelines that have not recorded an update for too long
 */
public class PipelineRecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineRecoveryEngine.class);

    private static final Duration DEFAULT_STALL_CHECK_INTERVAL = Duration.ofSeconds(60);

    private final TaskOrchestrator orchestrator;
    private final PipelineStateRepository repository;
    private final Duration stallThreshold;
    private final Duration stallCheckInterval;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public PipelineRecoveryEngine(TaskOrchestrator orchestrator, PipelineStateRepository repository) {
        this(orchestrator, repository, DEFAULT_STALL_CHECK_INTERVAL);
    }

    public PipelineRecoveryEngine(
            TaskOrchestrator orchestrator,
            PipelineStateRepository repository,
            Duration stallCheckInterval) {
        this.orchestrator = orchestrator;
        this.repository = repository;
        this.stallThreshold = orchestrator.context().config().stallThreshold();
        this.stallCheckInterval = stallCheckInterval;
        this.clock = orchestrator.context().clock();
        this.scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    /**
     * Resume interrupted pipelines, then start the periodic stall sweep.
     */
    public RecoveryReport start() {
        if (running) {
            log.warn("Recovery engine already running");
            return new RecoveryReport(List.of(), List.of(), List.of());
        }

        running = true;
        log.info("Starting recovery engine");

        RecoveryReport report = resumeInterrupted();

        scheduler.scheduleWithFixedDelay(
            this::sweepStalledPipelines,
            stallCheckInterval.toMillis(),
            stallCheckInterval.toMillis(),
            TimeUnit.MILLISECONDS
        );

        log.info("Recovery engine started: {} resumed, {} corrupt, {} failed",
            report.resumed().size(), report.corrupt().size(), report.failed().size());
        return report;
    }

    /**
     * Stop the recovery engine.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Recovery engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Reload every non-terminal persisted pipeline and execute it in the background.
     * Corrupt pipelines are reported and left as they are.
     */
    public RecoveryReport resumeInterrupted() {
        List<String> resumed = new ArrayList<>();
        List<String> corrupt = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        List<String> candidates = repository.findActiveTaskIds();
        if (!candidates.isEmpty()) {
            log.info("Found {} interrupted pipelines", candidates.size());
        }

        for (String taskId : candidates) {
            if (orchestrator.isActive(taskId)) {
                continue;
            }
            try {
                orchestrator.resume(taskId);
                if (orchestrator.isActive(taskId)) {
                    orchestrator.executeAsync(taskId).whenComplete((verdict, error) -> {
                        if (error != null) {
                            log.error("Resumed pipeline {} failed", taskId, error);
                        } else {
                            log.info("Resumed pipeline {} finished {}", taskId, verdict.stage());
                        }
                    });
                }
                resumed.add(taskId);
            } catch (CorruptStateException e) {
                log.error("Pipeline {} cannot be resumed, resubmit it under a new id: {}", taskId, e.getMessage());
                corrupt.add(taskId);
            } catch (Exception e) {
                log.error("Failed to resume pipeline {}", taskId, e);
                failed.add(taskId);
            }
        }
        return new RecoveryReport(resumed, corrupt, failed);
    }

    /**
     * Pipelines active in this process whose last recorded update is older than the stall threshold.
     */
    public List<String> detectStalledPipelines() {
        Instant cutoff = clock.instant().minus(stallThreshold);
        List<String> stalled = new ArrayList<>();
        for (PipelineState state : orchestrator.context().tracker().activeStates()) {
            if (state.updatedAt() != null && state.updatedAt().isBefore(cutoff)) {
                log.warn("Pipeline {} appears stalled (stage={}, last update={}, attempts={})",
                    state.taskId(), state.stage(), state.updatedAt(), state.attempts().size());
                stalled.add(state.taskId());
            }
        }
        return stalled;
    }

    private void sweepStalledPipelines() {
        if (!running) return;

        try {
            detectStalledPipelines();
        } catch (Exception e) {
            log.error("Error in stalled pipeline detection", e);
        }
    }
}
