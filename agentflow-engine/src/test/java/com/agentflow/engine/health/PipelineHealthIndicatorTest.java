package com.agentflow.engine.health;

import com.agentflow.core.test.TimeController;
import com.agentflow.engine.orchestrator.OrchestratorContext;
import com.agentflow.engine.orchestrator.TaskOrchestrator;
import com.agentflow.engine.orchestrator.TaskSubmission;
import com.agentflow.resilience.ResilienceGovernor;
import com.agentflow.resilience.ServicePolicy;
import com.agentflow.worker.CapabilityRegistry;
import com.agentflow.worker.WorkerResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineHealthIndicatorTest {

    private TimeController time;
    private ResilienceGovernor governor;
    private TaskOrchestrator orchestrator;
    private PipelineHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        time = TimeController.frozen();
        governor = new ResilienceGovernor(ServicePolicy.builder()
            .failureThreshold(2)
            .recoveryTimeout(Duration.ofSeconds(30))
            .build(), time);
        CapabilityRegistry registry = new CapabilityRegistry()
            .register("implementation", "impl-agent", request -> WorkerResult.success(null, List.of()));
        orchestrator = new TaskOrchestrator(OrchestratorContext.builder(registry)
            .clock(time)
            .governor(governor)
            .build());
        indicator = new PipelineHealthIndicator(governor, orchestrator);
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    @Test
    void health_shouldBeUpWhenAllCircuitsClosed() {
        governor.record("impl-agent", true);

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(Map.of("impl-agent", "CLOSED"), health.getDetails().get("circuits"));
        assertEquals(0, health.getDetails().get("activePipelines"));
        assertEquals(4, health.getDetails().get("parallelism"));
    }

    @Test
    void health_shouldBeDegradedWhenCircuitOpen() {
        governor.record("impl-agent", false);
        governor.record("impl-agent", false);

        Health health = indicator.health();

        assertEquals(PipelineHealthIndicator.DEGRADED, health.getStatus());
        assertEquals(Map.of("impl-agent", "OPEN"), health.getDetails().get("circuits"));
    }

    @Test
    void health_shouldCountActivePipelines() {
        orchestrator.submit(TaskSubmission.of("Fix typo in README.md"));

        Health health = indicator.health();

        assertTrue(health.getDetails().containsKey("inFlightDispatches"));
        assertEquals(1, health.getDetails().get("activePipelines"));
    }
}
