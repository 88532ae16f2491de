package com.agentflow.api.config;

import com.agentflow.core.model.CompletionPolicy;
import com.agentflow.core.model.Strategy;
import com.agentflow.resilience.ServicePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings bound from {@code agentflow.*}.
 */
@ConfigurationProperties(prefix = "agentflow")
public class AgentflowProperties {

    private OrchestratorProps orchestrator = new OrchestratorProps();
    private PersistenceProps persistence = new PersistenceProps();
    private RecoveryProps recovery = new RecoveryProps();

    /** Remote worker backends, one per capability. */
    private List<WorkerProps> workers = new ArrayList<>();

    /** Resilience policy applied to service keys without an entry in {@link #services}. */
    private ServicePolicyProps defaultPolicy = new ServicePolicyProps();

    /** Per service key overrides. */
    private Map<String, ServicePolicyProps> services = new LinkedHashMap<>();

    public OrchestratorProps getOrchestrator() {
        return orchestrator;
    }

    public void setOrchestrator(OrchestratorProps orchestrator) {
        this.orchestrator = orchestrator;
    }

    public PersistenceProps getPersistence() {
        return persistence;
    }

    public void setPersistence(PersistenceProps persistence) {
        this.persistence = persistence;
    }

    public RecoveryProps getRecovery() {
        return recovery;
    }

    public void setRecovery(RecoveryProps recovery) {
        this.recovery = recovery;
    }

    public List<WorkerProps> getWorkers() {
        return workers;
    }

    public void setWorkers(List<WorkerProps> workers) {
        this.workers = workers;
    }

    public ServicePolicyProps getDefaultPolicy() {
        return defaultPolicy;
    }

    public void setDefaultPolicy(ServicePolicyProps defaultPolicy) {
        this.defaultPolicy = defaultPolicy;
    }

    public Map<String, ServicePolicyProps> getServices() {
        return services;
    }

    public void setServices(Map<String, ServicePolicyProps> services) {
        this.services = services;
    }

    public static class OrchestratorProps {
        /** 0 derives parallelism from the registered worker slots. */
        private int maxParallelism = 0;
        private Duration subtaskTimeout = Duration.ofSeconds(120);
        private int maxRetries = 3;
        private List<Strategy> strategyOrder = new ArrayList<>(Strategy.defaultOrder());
        private int maxDescriptionLength = 20_000;
        private CompletionPolicy completionPolicy = CompletionPolicy.GRACEFUL_DEGRADATION;
        private int maxFanOut = 8;
        private Duration stallThreshold = Duration.ofMinutes(30);
        private int verdictCacheSize = 1024;

        public int getMaxParallelism() {
            return maxParallelism;
        }

        public void setMaxParallelism(int maxParallelism) {
            this.maxParallelism = maxParallelism;
        }

        public Duration getSubtaskTimeout() {
            return subtaskTimeout;
        }

        public void setSubtaskTimeout(Duration subtaskTimeout) {
            this.subtaskTimeout = subtaskTimeout;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public List<Strategy> getStrategyOrder() {
            return strategyOrder;
        }

        public void setStrategyOrder(List<Strategy> strategyOrder) {
            this.strategyOrder = strategyOrder;
        }

        public int getMaxDescriptionLength() {
            return maxDescriptionLength;
        }

        public void setMaxDescriptionLength(int maxDescriptionLength) {
            this.maxDescriptionLength = maxDescriptionLength;
        }

        public CompletionPolicy getCompletionPolicy() {
            return completionPolicy;
        }

        public void setCompletionPolicy(CompletionPolicy completionPolicy) {
            this.completionPolicy = completionPolicy;
        }

        public int getMaxFanOut() {
            return maxFanOut;
        }

        public void setMaxFanOut(int maxFanOut) {
            this.maxFanOut = maxFanOut;
        }

        public Duration getStallThreshold() {
            return stallThreshold;
        }

        public void setStallThreshold(Duration stallThreshold) {
            this.stallThreshold = stallThreshold;
        }

        public int getVerdictCacheSize() {
            return verdictCacheSize;
        }

        public void setVerdictCacheSize(int verdictCacheSize) {
            this.verdictCacheSize = verdictCacheSize;
        }
    }

    public static class PersistenceProps {
        /** Directory for JSON snapshots; pipelines are kept in memory only when unset. */
        private String snapshotDir;

        public String getSnapshotDir() {
            return snapshotDir;
        }

        public void setSnapshotDir(String snapshotDir) {
            this.snapshotDir = snapshotDir;
        }
    }

    public static class RecoveryProps {
        private boolean enabled = true;
        private Duration stallCheckInterval = Duration.ofMinutes(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getStallCheckInterval() {
            return stallCheckInterval;
        }

        public void setStallCheckInterval(Duration stallCheckInterval) {
            this.stallCheckInterval = stallCheckInterval;
        }
    }

    public static class WorkerProps {
        private String capability;
        private String serviceKey;
        private URI endpoint;
        private int slots = 4;
        private Duration requestTimeout = Duration.ofSeconds(120);

        public String getCapability() {
            return capability;
        }

        public void setCapability(String capability) {
            this.capability = capability;
        }

        public String getServiceKey() {
            return serviceKey;
        }

        public void setServiceKey(String serviceKey) {
            this.serviceKey = serviceKey;
        }

        public URI getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(URI endpoint) {
            this.endpoint = endpoint;
        }

        public int getSlots() {
            return slots;
        }

        public void setSlots(int slots) {
            this.slots = slots;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class ServicePolicyProps {
        private int failureThreshold = 5;
        private Duration failureWindow = Duration.ofSeconds(60);
        private Duration recoveryTimeout = Duration.ofSeconds(30);
        private int bucketCapacity = 10;
        private int refillTokens = 10;
        private Duration refillPeriod = Duration.ofMinutes(1);

        public ServicePolicy toPolicy() {
            return new ServicePolicy(failureThreshold, failureWindow, recoveryTimeout,
                bucketCapacity, refillTokens, refillPeriod);
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getFailureWindow() {
            return failureWindow;
        }

        public void setFailureWindow(Duration failureWindow) {
            this.failureWindow = failureWindow;
        }

        public Duration getRecoveryTimeout() {
            return recoveryTimeout;
        }

        public void setRecoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
        }

        public int getBucketCapacity() {
            return bucketCapacity;
        }

        public void setBucketCapacity(int bucketCapacity) {
            this.bucketCapacity = bucketCapacity;
        }

        public int getRefillTokens() {
            return refillTokens;
        }

        public void setRefillTokens(int refillTokens) {
            this.refillTokens = refillTokens;
        }

        public Duration getRefillPeriod() {
            return refillPeriod;
        }

        public void setRefillPeriod(Duration refillPeriod) {
            this.refillPeriod = refillPeriod;
        }
    }
}
