package com.agentflow.resilience;

import java.time.Duration;

/**
 * Circuit breaker and rate limiter configuration for one service key.
 *
 * Invariants:
 * - failureThreshold >= 1
 * - failureWindow, recoveryTimeout and refillPeriod are positive
 * - bucketCapacity >= 1 and refillTokens >= 1
 */
public record ServicePolicy(
    int failureThreshold,
    Duration failureWindow,
    Duration recoveryTimeout,
    int bucketCapacity,
    int refillTokens,
    Duration refillPeriod
) {
    public ServicePolicy {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        requirePositive(failureWindow, "failureWindow");
        requirePositive(recoveryTimeout, "recoveryTimeout");
        requirePositive(refillPeriod, "refillPeriod");
        if (bucketCapacity < 1) {
            throw new IllegalArgumentException("bucketCapacity must be >= 1");
        }
        if (refillTokens < 1) {
            throw new IllegalArgumentException("refillTokens must be >= 1");
        }
    }

    /**
     * Defaults: open after 5 failures within 60s, probe after 30s, 10 tokens refilled at 10 per minute.
     */
    public static ServicePolicy defaults() {
        return new ServicePolicy(5, Duration.ofSeconds(60), Duration.ofSeconds(30),
            10, 10, Duration.ofMinutes(1));
    }

    /**
     * Time for one token to refill.
     */
    public Duration refillInterval() {
        return refillPeriod.dividedBy(refillTokens);
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int failureThreshold = 5;
        private Duration failureWindow = Duration.ofSeconds(60);
        private Duration recoveryTimeout = Duration.ofSeconds(30);
        private int bucketCapacity = 10;
        private int refillTokens = 10;
        private Duration refillPeriod = Duration.ofMinutes(1);

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder failureWindow(Duration failureWindow) {
            this.failureWindow = failureWindow;
            return this;
        }

        public Builder recoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
            return this;
        }

        public Builder bucketCapacity(int bucketCapacity) {
            this.bucketCapacity = bucketCapacity;
            return this;
        }

        public Builder refill(int tokens, Duration period) {
            this.refillTokens = tokens;
            this.refillPeriod = period;
            return this;
        }

        public ServicePolicy build() {
            return new ServicePolicy(failureThreshold, failureWindow, recoveryTimeout,
                bucketCapacity, refillTokens, refillPeriod);
        }
    }
}
