package com.agentflow.core.model;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with cap and jitter, used to requeue subtasks whose dispatch was
 * refused by admission control.
 *
 * Invariants:
 * - initialBackoff > 0
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record BackoffPolicy(
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor
) {
    public BackoffPolicy {
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("initialBackoff must be positive");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0.0, 1.0]");
        }
    }

    /**
     * Admission backoff defaults: 1s base, doubling, capped at 30s, 10% jitter.
     */
    public static BackoffPolicy admissionDefaults() {
        return new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 0.1);
    }

    /**
     * Compute the delay before the given deferral is retried.
     *
     * @param deferralNumber 1-indexed count of consecutive refusals
     */
    public Duration computeBackoff(int deferralNumber) {
        if (deferralNumber < 1) {
            throw new IllegalArgumentException("Deferral number must be >= 1");
        }

        double baseMs = initialBackoff.toMillis() * Math.pow(backoffMultiplier, deferralNumber - 1);
        double cappedMs = Math.min(baseMs, maxBackoff.toMillis());

        // cappedMs * (1 - jitter + random(0, 2 * jitter)), never above the cap
        double jitterRange = cappedMs * jitterFactor;
        double jitteredMs = cappedMs - jitterRange
            + ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;

        return Duration.ofMillis((long) Math.min(jitteredMs, maxBackoff.toMillis()));
    }
}
