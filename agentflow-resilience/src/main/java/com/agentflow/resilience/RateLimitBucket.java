package com.agentflow.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of one service key's token bucket.
 *
 * @param timeUntilNextToken zero when a token is available now
 */
public record RateLimitBucket(
    String serviceKey,
    double tokens,
    int capacity,
    Duration refillInterval,
    Instant lastRefill,
    Duration timeUntilNextToken
) {
}
