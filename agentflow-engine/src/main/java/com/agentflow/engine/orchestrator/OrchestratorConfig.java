package com.agentflow.engine.orchestrator;

import com.agentflow.core.model.BackoffPolicy;
import com.agentflow.core.model.CompletionPolicy;
import com.agentflow.core.model.RetryPolicy;
import com.agentflow.core.model.Strategy;
import com.agentflow.resilience.ServicePolicy;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Tunables for the task orchestrator.
 *
 * @param maxParallelism upper bound on concurrently running subtasks; 0 means the sum of
 *        registered worker slots
 * @param subtaskTimeout how long one attempt may run before it is recorded as timed out
 * @param retryPolicy retry ceiling and strategy order
 * @param admissionBackoff delay schedule for subtasks refused by admission control
 * @param maxDescriptionLength longest accepted task description, in characters
 * @param completionPolicy how non-critical subtask failures affect the verdict
 * @param defaultServicePolicy circuit and rate-limit settings for services without an override
 * @param maxFanOut most implementation subtasks a fork-join decomposition produces
 * @param stallThreshold how long an active pipeline may go without a recorded update before
 *        the recovery sweep reports it as stalled
 * @param verdictCacheSize how many finished verdicts are kept in memory; older ones are
 *        rebuilt from persisted history on request
 */
public record OrchestratorConfig(
    int maxParallelism,
    Duration subtaskTimeout,
    RetryPolicy retryPolicy,
    BackoffPolicy admissionBackoff,
    int maxDescriptionLength,
    CompletionPolicy completionPolicy,
    ServicePolicy defaultServicePolicy,
    int maxFanOut,
    Duration stallThreshold,
    int verdictCacheSize
) {
    public OrchestratorConfig {
        if (maxParallelism < 0) {
            throw new IllegalArgumentException("maxParallelism must be >= 0");
        }
        if (subtaskTimeout == null || subtaskTimeout.isNegative() || subtaskTimeout.isZero()) {
            throw new IllegalArgumentException("subtaskTimeout must be positive");
        }
        if (maxDescriptionLength < 1) {
            throw new IllegalArgumentException("maxDescriptionLength must be >= 1");
        }
        if (maxFanOut < 1) {
            throw new IllegalArgumentException("maxFanOut must be >= 1");
        }
        if (verdictCacheSize < 1) {
            throw new IllegalArgumentException("verdictCacheSize must be >= 1");
        }
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(admissionBackoff, "admissionBackoff");
        Objects.requireNonNull(completionPolicy, "completionPolicy");
        Objects.requireNonNull(defaultServicePolicy, "defaultServicePolicy");
        Objects.requireNonNull(stallThreshold, "stallThreshold");
    }

    public static OrchestratorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxParallelism(maxParallelism)
            .subtaskTimeout(subtaskTimeout)
            .retryPolicy(retryPolicy)
            .admissionBackoff(admissionBackoff)
            .maxDescriptionLength(maxDescriptionLength)
            .completionPolicy(completionPolicy)
            .defaultServicePolicy(defaultServicePolicy)
            .maxFanOut(maxFanOut)
            .stallThreshold(stallThreshold)
            .verdictCacheSize(verdictCacheSize);
    }

    public static class Builder {
        private int maxParallelism = 0;
        private Duration subtaskTimeout = Duration.ofSeconds(120);
        private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();
        private BackoffPolicy admissionBackoff = BackoffPolicy.admissionDefaults();
        private int maxDescriptionLength = 20_000;
        private CompletionPolicy completionPolicy = CompletionPolicy.GRACEFUL_DEGRADATION;
        private ServicePolicy defaultServicePolicy = ServicePolicy.defaults();
        private int maxFanOut = 8;
        private Duration stallThreshold = Duration.ofMinutes(30);
        private int verdictCacheSize = 1024;

        public Builder maxParallelism(int maxParallelism) {
            this.maxParallelism = maxParallelism;
            return this;
        }

        public Builder subtaskTimeout(Duration subtaskTimeout) {
            this.subtaskTimeout = subtaskTimeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.retryPolicy = retryPolicy.withMaxRetries(maxRetries);
            return this;
        }

        public Builder strategyOrder(List<Strategy> strategyOrder) {
            this.retryPolicy = new RetryPolicy(retryPolicy.maxRetries(), strategyOrder, retryPolicy.nonRetryableErrors());
            return this;
        }

        public Builder admissionBackoff(BackoffPolicy admissionBackoff) {
            this.admissionBackoff = admissionBackoff;
            return this;
        }

        public Builder maxDescriptionLength(int maxDescriptionLength) {
            this.maxDescriptionLength = maxDescriptionLength;
            return this;
        }

        public Builder completionPolicy(CompletionPolicy completionPolicy) {
            this.completionPolicy = completionPolicy;
            return this;
        }

        public Builder defaultServicePolicy(ServicePolicy defaultServicePolicy) {
            this.defaultServicePolicy = defaultServicePolicy;
            return this;
        }

        public Builder maxFanOut(int maxFanOut) {
            this.maxFanOut = maxFanOut;
            return this;
        }

        public Builder stallThreshold(Duration stallThreshold) {
            this.stallThreshold = stallThreshold;
            return this;
        }

        public Builder verdictCacheSize(int verdictCacheSize) {
            this.verdictCacheSize = verdictCacheSize;
            return this;
        }

        public OrchestratorConfig build() {
            return new OrchestratorConfig(maxParallelism, subtaskTimeout, retryPolicy, admissionBackoff,
                maxDescriptionLength, completionPolicy, defaultServicePolicy, maxFanOut, stallThreshold,
                verdictCacheSize);
        }
    }
}
