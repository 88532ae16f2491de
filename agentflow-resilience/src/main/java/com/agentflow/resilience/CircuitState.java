package com.agentflow.resilience;

/**
 * Circuit breaker states for one external service key.
 */
public enum CircuitState {
    /**
     * Calls flow, subject to the rate limiter.
     * Transitions: -> OPEN (failure threshold reached within the window)
     */
    CLOSED,

    /**
     * Calls are refused until the recovery timeout elapses.
     * Transitions: -> HALF_OPEN
     */
    OPEN,

    /**
     * A single probe call is in flight.
     * Transitions: -> CLOSED (probe succeeded), OPEN (probe failed)
     */
    HALF_OPEN;

    public boolean canTransitionTo(CircuitState target) {
        return switch (this) {
            case CLOSED -> target == OPEN;
            case OPEN -> target == HALF_OPEN;
            case HALF_OPEN -> target == CLOSED || target == OPEN;
        };
    }
}
