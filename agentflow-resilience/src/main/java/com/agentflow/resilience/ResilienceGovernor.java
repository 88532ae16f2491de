package com.agentflow.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admission control for external services: a circuit breaker in front of a token bucket,
 * one pair per service key.
 *
 * Each key has its own lock; all reads and writes of a key's breaker and bucket go through it,
 * and different keys never contend. A refused admission is not an error: callers defer and
 * retry later.
 */
public class ResilienceGovernor {

    private static final Logger log = LoggerFactory.getLogger(ResilienceGovernor.class);

    private final ServicePolicy defaultPolicy;
    private final Clock clock;
    private final Map<String, ServicePolicy> policies = new ConcurrentHashMap<>();
    private final Map<String, ServiceGuard> guards = new ConcurrentHashMap<>();
    private final List<CircuitTransitionListener> listeners = new CopyOnWriteArrayList<>();

    public ResilienceGovernor(ServicePolicy defaultPolicy, Clock clock) {
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ResilienceGovernor() {
        this(ServicePolicy.defaults(), Clock.systemUTC());
    }

    /**
     * Override the policy for one service key. Resets that key's breaker and bucket.
     */
    public void configure(String serviceKey, ServicePolicy policy) {
        policies.put(serviceKey, policy);
        guards.remove(serviceKey);
        log.info("Configured service {}: threshold={} window={} recovery={} capacity={} refill={}/{}",
            serviceKey, policy.failureThreshold(), policy.failureWindow(), policy.recoveryTimeout(),
            policy.bucketCapacity(), policy.refillTokens(), policy.refillPeriod());
    }

    public void addListener(CircuitTransitionListener listener) {
        listeners.add(listener);
    }

    /**
     * May a call to this service be made now?
     *
     * OPEN before the recovery timeout refuses. OPEN after it moves to HALF_OPEN and admits
     * exactly one probe. While the probe is in flight further calls are refused. CLOSED defers
     * to the token bucket.
     */
    public boolean admit(String serviceKey) {
        ServiceGuard guard = guardFor(serviceKey);
        guard.lock.lock();
        try {
            Instant now = clock.instant();
            CircuitBreaker breaker = guard.breaker;
            switch (breaker.state()) {
                case OPEN -> {
                    if (!breaker.recoveryTimeoutElapsed(now)) {
                        log.debug("Refused {}: circuit open", serviceKey);
                        return false;
                    }
                    CircuitState from = breaker.beginProbe(now);
                    notifyTransition(serviceKey, from, CircuitState.HALF_OPEN);
                    log.info("Circuit for {} half-open, admitting probe", serviceKey);
                    return true;
                }
                case HALF_OPEN -> {
                    if (breaker.probeAbandoned(now)) {
                        breaker.restartProbe(now);
                        log.warn("Probe for {} never reported back, admitting a new one", serviceKey);
                        return true;
                    }
                    log.debug("Refused {}: probe in flight", serviceKey);
                    return false;
                }
                default -> {
                    boolean acquired = guard.limiter.tryAcquire(now);
                    if (!acquired) {
                        log.debug("Refused {}: rate limit", serviceKey);
                    }
                    return acquired;
                }
            }
        } finally {
            guard.lock.unlock();
        }
    }

    /**
     * Record the outcome of a call that was admitted and completed.
     */
    public void record(String serviceKey, boolean success) {
        record(serviceKey, success, null);
    }

    /**
     * Record the outcome of a call admitted at {@code dispatchedAt}. A call admitted before the
     * current half-open probe cannot close or reopen the circuit.
     */
    public void record(String serviceKey, boolean success, Instant dispatchedAt) {
        ServiceGuard guard = guardFor(serviceKey);
        guard.lock.lock();
        try {
            CircuitBreaker breaker = guard.breaker;
            CircuitState from = breaker.onOutcome(success, dispatchedAt, clock.instant());
            if (from == null && breaker.state() == CircuitState.HALF_OPEN) {
                log.debug("Ignored outcome for {} from a call admitted before the probe", serviceKey);
            }
            if (from != null) {
                CircuitState to = breaker.state();
                notifyTransition(serviceKey, from, to);
                if (to == CircuitState.OPEN) {
                    log.warn("Circuit for {} opened ({} -> OPEN)", serviceKey, from);
                } else {
                    log.info("Circuit for {} closed after successful probe", serviceKey);
                }
            }
        } finally {
            guard.lock.unlock();
        }
    }

    public CircuitBreakerState circuitState(String serviceKey) {
        ServiceGuard guard = guardFor(serviceKey);
        guard.lock.lock();
        try {
            return guard.breaker.snapshot();
        } finally {
            guard.lock.unlock();
        }
    }

    public RateLimitBucket bucket(String serviceKey) {
        ServiceGuard guard = guardFor(serviceKey);
        guard.lock.lock();
        try {
            return guard.limiter.snapshot(clock.instant());
        } finally {
            guard.lock.unlock();
        }
    }

    /**
     * Snapshots of every service key seen so far, sorted by key.
     */
    public Map<String, ServiceSnapshot> snapshots() {
        Map<String, ServiceSnapshot> result = new TreeMap<>();
        for (String key : guards.keySet()) {
            result.put(key, new ServiceSnapshot(circuitState(key), bucket(key)));
        }
        return result;
    }

    public ServicePolicy policyFor(String serviceKey) {
        return policies.getOrDefault(serviceKey, defaultPolicy);
    }

    // ========== Internal Methods ==========

    private ServiceGuard guardFor(String serviceKey) {
        Objects.requireNonNull(serviceKey, "serviceKey");
        return guards.computeIfAbsent(serviceKey,
            key -> new ServiceGuard(key, policyFor(key), clock.instant()));
    }

    private void notifyTransition(String serviceKey, CircuitState from, CircuitState to) {
        for (CircuitTransitionListener listener : listeners) {
            try {
                listener.onTransition(serviceKey, from, to);
            } catch (RuntimeException e) {
                log.error("Circuit transition listener failed for {}", serviceKey, e);
            }
        }
    }

    /**
     * Breaker and bucket for one key, guarded by one lock.
     */
    private static final class ServiceGuard {
        private final ReentrantLock lock = new ReentrantLock();
        private final CircuitBreaker breaker;
        private final RateLimiter limiter;

        private ServiceGuard(String serviceKey, ServicePolicy policy, Instant now) {
            this.breaker = new CircuitBreaker(serviceKey, policy, now);
            this.limiter = new RateLimiter(serviceKey, policy, now);
        }
    }

    /**
     * Combined view of one key's breaker and bucket.
     */
    public record ServiceSnapshot(CircuitBreakerState circuit, RateLimitBucket bucket) {
    }
}
