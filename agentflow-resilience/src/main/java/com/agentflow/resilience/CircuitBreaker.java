package com.agentflow.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * Failure-rate state machine for one service key.
 * Not thread-safe: callers serialize access through the owning {@link ResilienceGovernor}.
 *
 * Only the transitions allowed by {@link CircuitState#canTransitionTo} are ever taken.
 */
public class CircuitBreaker {

    private final String serviceKey;
    private final int failureThreshold;
    private final Duration failureWindow;
    private final Duration recoveryTimeout;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant windowStart;
    private Instant lastTransition;
    private Instant probeStartedAt;

    public CircuitBreaker(String serviceKey, ServicePolicy policy, Instant now) {
        this.serviceKey = serviceKey;
        this.failureThreshold = policy.failureThreshold();
        this.failureWindow = policy.failureWindow();
        this.recoveryTimeout = policy.recoveryTimeout();
        this.windowStart = now;
        this.lastTransition = now;
    }

    public CircuitState state() {
        return state;
    }

    public boolean recoveryTimeoutElapsed(Instant now) {
        return !now.isBefore(lastTransition.plus(recoveryTimeout));
    }

    /**
     * OPEN -> HALF_OPEN, marking the single probe as in flight.
     */
    CircuitState beginProbe(Instant now) {
        CircuitState from = transitionTo(CircuitState.HALF_OPEN, now);
        probeStartedAt = now;
        return from;
    }

    /**
     * A probe that was admitted but never reported back is abandoned after one recovery timeout,
     * letting a new probe through.
     */
    boolean probeAbandoned(Instant now) {
        return state == CircuitState.HALF_OPEN
            && probeStartedAt != null
            && !now.isBefore(probeStartedAt.plus(recoveryTimeout));
    }

    void restartProbe(Instant now) {
        probeStartedAt = now;
    }

    /**
     * Record a call outcome. While HALF_OPEN only the probe decides the next state; outcomes of
     * calls dispatched before the current probe was admitted are ignored.
     *
     * @param dispatchedAt when the call was admitted, or null if unknown
     * @return the state before the call if this outcome caused a transition, otherwise null
     */
    CircuitState onOutcome(boolean success, Instant dispatchedAt, Instant now) {
        return switch (state) {
            case HALF_OPEN -> {
                if (dispatchedAt != null && probeStartedAt != null && dispatchedAt.isBefore(probeStartedAt)) {
                    yield null;
                }
                yield success
                    ? transitionTo(CircuitState.CLOSED, now)
                    : transitionTo(CircuitState.OPEN, now);
            }
            case CLOSED -> success ? null : onClosedFailure(now);
            // Late outcome of a call dispatched before the circuit opened
            case OPEN -> null;
        };
    }

    private CircuitState onClosedFailure(Instant now) {
        if (!now.isBefore(windowStart.plus(failureWindow))) {
            windowStart = now;
            failureCount = 0;
        }
        failureCount++;
        if (failureCount >= failureThreshold) {
            return transitionTo(CircuitState.OPEN, now);
        }
        return null;
    }

    private CircuitState transitionTo(CircuitState target, Instant now) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                "Illegal circuit transition for %s: %s -> %s", serviceKey, state, target));
        }
        CircuitState from = state;
        state = target;
        lastTransition = now;
        probeStartedAt = null;
        if (target == CircuitState.CLOSED) {
            failureCount = 0;
            windowStart = now;
        }
        return from;
    }

    public CircuitBreakerState snapshot() {
        return new CircuitBreakerState(serviceKey, state, failureCount, windowStart, lastTransition,
            failureThreshold, recoveryTimeout);
    }
}
