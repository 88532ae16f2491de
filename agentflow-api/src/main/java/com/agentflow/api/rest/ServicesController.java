package com.agentflow.api.rest;

import com.agentflow.resilience.ResilienceGovernor;
import com.agentflow.resilience.ResilienceGovernor.ServiceSnapshot;
import com.agentflow.worker.CapabilityRegistry;
import com.agentflow.worker.WorkerRegistration;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Circuit breaker and rate limiter state of each external service, and the workers bound to them.
 */
@RestController
@RequestMapping("/api/v1/services")
public class ServicesController {

    private final ResilienceGovernor governor;
    private final CapabilityRegistry registry;

    public ServicesController(ResilienceGovernor governor, CapabilityRegistry registry) {
        this.governor = governor;
        this.registry = registry;
    }

    @GetMapping
    public ResponseEntity<ServicesResponse> getServices() {
        List<WorkerView> workers = registry.capabilities().stream()
            .map(registry::resolve)
            .map(WorkerView::from)
            .toList();
        return ResponseEntity.ok(new ServicesResponse(governor.snapshots(), workers));
    }

    public record ServicesResponse(
        Map<String, ServiceSnapshot> services,
        List<WorkerView> workers
    ) {}

    public record WorkerView(String capability, String serviceKey, int slots) {
        static WorkerView from(WorkerRegistration registration) {
            return new WorkerView(registration.capability(), registration.serviceKey(), registration.slots());
        }
    }
}
