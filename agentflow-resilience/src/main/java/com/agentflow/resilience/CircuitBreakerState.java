package com.agentflow.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of one service key's circuit breaker.
 */
public record CircuitBreakerState(
    String serviceKey,
    CircuitState state,
    int failureCount,
    Instant windowStart,
    Instant lastTransition,
    int failureThreshold,
    Duration recoveryTimeout
) {
}
