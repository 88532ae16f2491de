package com.agentflow.engine.health;

import com.agentflow.engine.orchestrator.TaskOrchestrator;
import com.agentflow.resilience.CircuitState;
import com.agentflow.resilience.ResilienceGovernor;
import com.agentflow.resilience.ResilienceGovernor.ServiceSnapshot;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of the orchestration pipeline.
 * Reports status based on:
 * - Circuit state of every service key seen so far
 * - Active pipelines and in-flight dispatches
 *
 * UP when every circuit is CLOSED, DEGRADED when some circuit is OPEN or probing.
 */
public class PipelineHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Some external services are failing");

    private final ResilienceGovernor governor;
    private final TaskOrchestrator orchestrator;

    public PipelineHealthIndicator(ResilienceGovernor governor, TaskOrchestrator orchestrator) {
        this.governor = governor;
        this.orchestrator = orchestrator;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        try {
            Map<String, String> circuits = new LinkedHashMap<>();
            boolean degraded = false;
            for (Map.Entry<String, ServiceSnapshot> entry : governor.snapshots().entrySet()) {
                CircuitState state = entry.getValue().circuit().state();
                circuits.put(entry.getKey(), state.name());
                degraded |= state != CircuitState.CLOSED;
            }
            details.put("circuits", circuits);
            details.put("activePipelines", orchestrator.activePipelineIds().size());
            details.put("inFlightDispatches", orchestrator.context().metrics().inFlight());
            details.put("parallelism", orchestrator.parallelism());

            return Health.status(degraded ? DEGRADED : Status.UP)
                .withDetails(details)
                .build();
        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }
}
