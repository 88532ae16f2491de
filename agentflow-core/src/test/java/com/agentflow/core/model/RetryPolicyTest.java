package com.agentflow.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void defaultPolicy_shouldHaveReasonableDefaults() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(3, policy.maxRetries());
        assertEquals(List.of(Strategy.DIRECT, Strategy.MECHANICAL_FIX, Strategy.REGENERATE, Strategy.SIMPLIFY),
            policy.strategyOrder());
    }

    @Test
    void nextStrategy_shouldFollowEscalationOrder() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(Optional.of(Strategy.DIRECT), policy.nextStrategy(Set.of(), 0));
        assertEquals(Optional.of(Strategy.MECHANICAL_FIX), policy.nextStrategy(EnumSet.of(Strategy.DIRECT), 1));
        assertEquals(Optional.of(Strategy.REGENERATE),
            policy.nextStrategy(EnumSet.of(Strategy.DIRECT, Strategy.MECHANICAL_FIX), 2));
    }

    @Test
    void nextStrategy_shouldStopAtRetryCeiling() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        Set<Strategy> tried = EnumSet.of(Strategy.DIRECT, Strategy.MECHANICAL_FIX, Strategy.REGENERATE);

        assertEquals(Optional.empty(), policy.nextStrategy(tried, 3));
    }

    @Test
    void nextStrategy_shouldStopWhenStrategiesExhausted() {
        RetryPolicy policy = RetryPolicy.builder().maxRetries(10).build();

        assertEquals(Optional.empty(), policy.nextStrategy(EnumSet.allOf(Strategy.class), 4));
    }

    @Test
    void nextStrategy_firstAttemptIgnoresTaskWideCeiling() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(Optional.of(Strategy.DIRECT), policy.nextStrategy(Set.of(), 3));
    }

    @Test
    void nextStrategy_shouldHonorCustomOrder() {
        RetryPolicy policy = RetryPolicy.builder()
            .strategyOrder(List.of(Strategy.REGENERATE, Strategy.SIMPLIFY))
            .build();

        assertEquals(Optional.of(Strategy.REGENERATE), policy.nextStrategy(Set.of(), 0));
        assertEquals(Optional.of(Strategy.SIMPLIFY), policy.nextStrategy(EnumSet.of(Strategy.REGENERATE), 1));
    }

    @Test
    void constructor_shouldRejectInvalidPolicies() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxRetries(0).build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().strategyOrder(List.of()).build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder()
            .strategyOrder(List.of(Strategy.DIRECT, Strategy.DIRECT)).build());
    }

    @Test
    void shouldRetry_withNonRetryableList_shouldExclude() {
        RetryPolicy policy = RetryPolicy.builder()
            .nonRetryableErrors(Set.of("ACCESS_DENIED"))
            .build();

        assertFalse(policy.shouldRetry("ACCESS_DENIED"));
        assertTrue(policy.shouldRetry("SYNTAX"));
        assertTrue(policy.shouldRetry(null));
    }

    @Test
    void computeBackoff_shouldIncreaseExponentially() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 0.0);

        assertEquals(Duration.ofSeconds(1), policy.computeBackoff(1));
        assertEquals(Duration.ofSeconds(2), policy.computeBackoff(2));
        assertEquals(Duration.ofSeconds(4), policy.computeBackoff(3));
    }

    @Test
    void computeBackoff_shouldRespectCapWithJitter() {
        BackoffPolicy policy = BackoffPolicy.admissionDefaults();

        for (int i = 1; i <= 20; i++) {
            Duration backoff = policy.computeBackoff(i);
            assertTrue(backoff.compareTo(Duration.ofSeconds(30)) <= 0, "deferral " + i + " was " + backoff);
            assertTrue(backoff.compareTo(Duration.ofMillis(900)) >= 0, "deferral " + i + " was " + backoff);
        }
    }
}
