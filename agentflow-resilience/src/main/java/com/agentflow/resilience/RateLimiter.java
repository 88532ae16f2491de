package com.agentflow.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * Token bucket for one service key with continuous refill.
 * Not thread-safe: callers serialize access through the owning {@link ResilienceGovernor}.
 */
public class RateLimiter {

    private final String serviceKey;
    private final int capacity;
    private final int refillTokens;
    private final long refillPeriodNanos;
    private final Duration refillInterval;

    private double tokens;
    private Instant lastRefill;

    public RateLimiter(String serviceKey, ServicePolicy policy, Instant now) {
        this.serviceKey = serviceKey;
        this.capacity = policy.bucketCapacity();
        this.refillTokens = policy.refillTokens();
        this.refillPeriodNanos = policy.refillPeriod().toNanos();
        this.refillInterval = policy.refillInterval();
        this.tokens = capacity;
        this.lastRefill = now;
    }

    /**
     * Consume one token if available.
     *
     * @return true if a token was consumed
     */
    public boolean tryAcquire(Instant now) {
        refill(now);
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    /**
     * Time until one whole token is available; zero if one is available now.
     */
    public Duration timeUntilNextToken(Instant now) {
        refill(now);
        if (tokens >= 1.0) {
            return Duration.ZERO;
        }
        return Duration.ofNanos((long) Math.ceil((1.0 - tokens) * refillPeriodNanos / refillTokens));
    }

    public RateLimitBucket snapshot(Instant now) {
        refill(now);
        return new RateLimitBucket(serviceKey, tokens, capacity, refillInterval, lastRefill,
            timeUntilNextToken(now));
    }

    private void refill(Instant now) {
        if (!now.isAfter(lastRefill)) {
            return;
        }
        Duration elapsed = Duration.between(lastRefill, now);
        lastRefill = now;
        // Idle long enough to refill from empty
        if (elapsed.compareTo(refillInterval.multipliedBy(capacity)) >= 0) {
            tokens = capacity;
            return;
        }
        double added = (double) (elapsed.toNanos() * refillTokens) / refillPeriodNanos;
        tokens = Math.min(capacity, tokens + added);
    }
}
