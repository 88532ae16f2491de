package com.agentflow.resilience;

import com.agentflow.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ResilienceGovernorTest {

    private static final String SERVICE = "worker-backend";

    private TimeController time;
    private ResilienceGovernor governor;

    @BeforeEach
    void setUp() {
        time = TimeController.frozenAt(Instant.parse("2024-03-01T10:00:00Z"));
        governor = new ResilienceGovernor(ServicePolicy.defaults(), time);
    }

    @Nested
    @DisplayName("Circuit breaker")
    class CircuitBreakerBehavior {

        @Test
        @DisplayName("Always-failing service opens the circuit, then admits exactly one probe after recovery")
        void alwaysFailingService() {
            failCalls(5);

            assertThat(governor.circuitState(SERVICE).state()).isEqualTo(CircuitState.OPEN);
            assertThat(governor.admit(SERVICE)).isFalse();

            time.advance(Duration.ofSeconds(29));
            assertThat(governor.admit(SERVICE)).isFalse();

            time.advance(Duration.ofSeconds(1));
            assertThat(governor.admit(SERVICE)).isTrue();
            assertThat(governor.circuitState(SERVICE).state()).isEqualTo(CircuitState.HALF_OPEN);
            assertThat(governor.admit(SERVICE)).isFalse();
            assertThat(governor.admit(SERVICE)).isFalse();

            governor.record(SERVICE, false);
            assertThat(governor.circuitState(SERVICE).state()).isEqualTo(CircuitState.OPEN);
            assertThat(governor.admit(SERVICE)).isFalse();
        }

        @Test
        @DisplayName("Successful probe closes the circuit and resets the failure counter")
        void successfulProbeCloses() {
            failCalls(5);
            time.advance(Duration.ofSeconds(30));

            assertThat(governor.admit(SERVICE)).isTrue();
            governor.record(SERVICE, true);

            CircuitBreakerState state = governor.circuitState(SERVICE);
            assertThat(state.state()).isEqualTo(CircuitState.CLOSED);
            assertThat(state.failureCount()).isZero();
            assertThat(governor.admit(SERVICE)).isTrue();
        }

        @Test
        @DisplayName("Failures spread over more than one window do not open the circuit")
        void windowResets() {
            failCalls(4);
            time.advance(Duration.ofSeconds(61));
            failCalls(1);

            CircuitBreakerState state = governor.circuitState(SERVICE);
            assertThat(state.state()).isEqualTo(CircuitState.CLOSED);
            assertThat(state.failureCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Outcomes arriving while OPEN do not change state")
        void lateOutcomesIgnored() {
            failCalls(5);
            governor.record(SERVICE, true);
            governor.record(SERVICE, false);

            assertThat(governor.circuitState(SERVICE).state()).isEqualTo(CircuitState.OPEN);
        }

        @Test
        @DisplayName("While half-open, outcomes of calls admitted before the trial call do not decide the circuit")
        void callsAdmittedEarlierIgnoredWhileHalfOpen() {
            Instant slowCallAdmitted = time.instant();
            failCalls(5);
            time.advance(Duration.ofSeconds(30));
            assertThat(governor.admit(SERVICE)).isTrue();
            Instant trialAdmitted = time.instant();

            time.advance(Duration.ofSeconds(5));
            governor.record(SERVICE, true, slowCallAdmitted);

            assertThat(governor.circuitState(SERVICE).state()).isEqualTo(CircuitState.HALF_OPEN);
            assertThat(governor.admit(SERVICE)).isFalse();

            governor.record(SERVICE, false, trialAdmitted);
            assertThat(governor.circuitState(SERVICE).state()).isEqualTo(CircuitState.OPEN);
        }

        @Test
        @DisplayName("A replaced trial call reporting late does not decide the circuit")
        void replacedTrialCallReportingLate() {
            failCalls(5);
            time.advance(Duration.ofSeconds(30));
            assertThat(governor.admit(SERVICE)).isTrue();
            Instant firstTrial = time.instant();

            time.advance(Duration.ofSeconds(30));
            assertThat(governor.admit(SERVICE)).isTrue();
            Instant secondTrial = time.instant();

            governor.record(SERVICE, false, firstTrial);
            assertThat(governor.circuitState(SERVICE).state()).isEqualTo(CircuitState.HALF_OPEN);

            governor.record(SERVICE, true, secondTrial);
            assertThat(governor.circuitState(SERVICE).state()).isEqualTo(CircuitState.CLOSED);
        }

        @Test
        @DisplayName("Abandoned probe is replaced after another recovery timeout")
        void abandonedProbe() {
            failCalls(5);
            time.advance(Duration.ofSeconds(30));
            assertThat(governor.admit(SERVICE)).isTrue();

            time.advance(Duration.ofSeconds(30));
            assertThat(governor.admit(SERVICE)).isTrue();
            assertThat(governor.circuitState(SERVICE).state()).isEqualTo(CircuitState.HALF_OPEN);
        }

        @Test
        @DisplayName("Listeners see only legal transitions")
        void listenerTransitions() {
            List<String> transitions = new ArrayList<>();
            governor.addListener((key, from, to) -> {
                assertThat(from.canTransitionTo(to)).isTrue();
                transitions.add(from + "->" + to);
            });

            failCalls(5);
            time.advance(Duration.ofSeconds(30));
            governor.admit(SERVICE);
            governor.record(SERVICE, true);

            assertThat(transitions).containsExactly("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED");
        }
    }

    @Nested
    @DisplayName("Rate limiter")
    class RateLimiterBehavior {

        @Test
        @DisplayName("capacity + 1 instantaneous calls yield capacity admissions and one refusal")
        void burstAboveCapacity() {
            int admitted = 0;
            int refused = 0;
            for (int i = 0; i < 11; i++) {
                if (governor.admit(SERVICE)) {
                    admitted++;
                } else {
                    refused++;
                }
            }

            assertThat(admitted).isEqualTo(10);
            assertThat(refused).isEqualTo(1);
        }

        @Test
        @DisplayName("One refill interval later exactly one more call is admitted")
        void refillOneInterval() {
            for (int i = 0; i < 11; i++) {
                governor.admit(SERVICE);
            }

            time.advance(ServicePolicy.defaults().refillInterval());

            assertThat(governor.admit(SERVICE)).isTrue();
            assertThat(governor.admit(SERVICE)).isFalse();
        }

        @Test
        @DisplayName("Bucket snapshot reports time until the next token")
        void retryAfterHint() {
            for (int i = 0; i < 10; i++) {
                governor.admit(SERVICE);
            }
            time.advance(Duration.ofSeconds(2));

            RateLimitBucket bucket = governor.bucket(SERVICE);

            assertThat(bucket.tokens()).isLessThan(1.0);
            assertThat(bucket.timeUntilNextToken()).isBetween(Duration.ofMillis(3999), Duration.ofMillis(4001));
        }

        @Test
        @DisplayName("Long idle periods never overfill the bucket")
        void idleCapsAtCapacity() {
            governor.admit(SERVICE);
            time.advance(Duration.ofDays(30));

            assertThat(governor.bucket(SERVICE).tokens()).isEqualTo(10.0);
        }
    }

    @Test
    @DisplayName("Service keys are isolated from each other")
    void keysIsolated() {
        failCalls(5);

        assertThat(governor.admit(SERVICE)).isFalse();
        assertThat(governor.admit("other-backend")).isTrue();
        assertThat(governor.snapshots()).containsOnlyKeys(SERVICE, "other-backend");
    }

    @Test
    @DisplayName("Per-key policy overrides apply")
    void perKeyPolicy() {
        governor.configure(SERVICE, ServicePolicy.builder().failureThreshold(1).bucketCapacity(2).build());

        assertThat(governor.admit(SERVICE)).isTrue();
        governor.record(SERVICE, false);

        assertThat(governor.circuitState(SERVICE).state()).isEqualTo(CircuitState.OPEN);
        assertThat(governor.policyFor("other").failureThreshold()).isEqualTo(5);
    }

    @Test
    @DisplayName("Concurrent admissions never exceed bucket capacity")
    void concurrentAdmissions() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        try {
            for (int i = 0; i < 100; i++) {
                executor.submit(() -> {
                    start.await();
                    if (governor.admit(SERVICE)) {
                        admitted.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(admitted.get()).isEqualTo(10);
    }

    private void failCalls(int count) {
        for (int i = 0; i < count; i++) {
            assertThat(governor.admit(SERVICE)).isTrue();
            governor.record(SERVICE, false);
        }
    }
}
