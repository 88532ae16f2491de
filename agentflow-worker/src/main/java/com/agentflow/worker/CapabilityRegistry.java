package com.agentflow.worker;

import com.agentflow.core.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit capability-to-worker registry. Workers are registered by the code that builds
 * an orchestrator; nothing is discovered at runtime.
 */
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private static final int DEFAULT_SLOTS = 4;

    private final Map<String, WorkerRegistration> registrations = new ConcurrentHashMap<>();

    public CapabilityRegistry register(String capability, String serviceKey, Worker worker) {
        return register(new WorkerRegistration(capability, serviceKey, worker, DEFAULT_SLOTS));
    }

    public CapabilityRegistry register(WorkerRegistration registration) {
        WorkerRegistration previous = registrations.put(registration.capability(), registration);
        if (previous != null) {
            log.warn("Replaced worker for capability '{}' (service {} -> {})",
                registration.capability(), previous.serviceKey(), registration.serviceKey());
        } else {
            log.info("Registered worker for capability '{}' on service {} with {} slots",
                registration.capability(), registration.serviceKey(), registration.slots());
        }
        return this;
    }

    /**
     * @throws NotFoundException if no worker is registered for the capability
     */
    public WorkerRegistration resolve(String capability) {
        WorkerRegistration registration = registrations.get(capability);
        if (registration == null) {
            throw new NotFoundException("Worker capability", capability);
        }
        return registration;
    }

    public boolean supports(String capability) {
        return registrations.containsKey(capability);
    }

    /** Returns all registered capabilities (sorted). */
    public List<String> capabilities() {
        return registrations.keySet().stream().sorted().toList();
    }

    /**
     * Total concurrent calls the registered workers accept, counting each service key once.
     */
    public int totalSlots() {
        Map<String, Integer> slotsByService = new ConcurrentHashMap<>();
        registrations.values().forEach(r -> slotsByService.merge(r.serviceKey(), r.slots(), Math::max));
        return slotsByService.values().stream().mapToInt(Integer::intValue).sum();
    }
}
