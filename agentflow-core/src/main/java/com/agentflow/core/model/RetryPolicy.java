package com.agentflow.core.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Retry ceiling and strategy escalation order for a Task's subtasks.
 * Immutable and shared across pipelines.
 *
 * Invariants:
 * - maxRetries >= 1
 * - strategyOrder is non-empty and has no duplicates
 * - nonRetryableErrors lists worker error codes that end a subtask immediately
 */
public record RetryPolicy(
    int maxRetries,
    List<Strategy> strategyOrder,
    Set<String> nonRetryableErrors
) {
    public RetryPolicy {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1");
        }
        if (strategyOrder == null || strategyOrder.isEmpty()) {
            throw new IllegalArgumentException("strategyOrder must not be empty");
        }
        if (EnumSet.copyOf(strategyOrder).size() != strategyOrder.size()) {
            throw new IllegalArgumentException("strategyOrder must not repeat a strategy: " + strategyOrder);
        }
        strategyOrder = List.copyOf(strategyOrder);
        nonRetryableErrors = nonRetryableErrors != null ? Set.copyOf(nonRetryableErrors) : Set.of();
    }

    /**
     * Default policy: 3 retries, direct -> mechanical-fix -> regenerate -> simplify.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, Strategy.defaultOrder(), Set.of());
    }

    /**
     * Single direct attempt, no retries.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, List.of(Strategy.DIRECT), Set.of());
    }

    /**
     * Choose the strategy for a subtask's next attempt.
     *
     * A subtask's first attempt always gets the first strategy. Later attempts take the
     * first strategy in order not yet tried, provided the task-wide retry count is below
     * the ceiling.
     *
     * @param tried strategies already used for this subtask
     * @param retryCount task-wide retry count
     * @return the next strategy, or empty when retries or strategies are exhausted
     */
    public Optional<Strategy> nextStrategy(Set<Strategy> tried, int retryCount) {
        if (!tried.isEmpty() && !hasRetriesLeft(retryCount)) {
            return Optional.empty();
        }
        return strategyOrder.stream()
            .filter(s -> !tried.contains(s))
            .findFirst();
    }

    public boolean hasRetriesLeft(int retryCount) {
        return retryCount < maxRetries;
    }

    /**
     * Check if a worker error code may be retried with another strategy.
     */
    public boolean shouldRetry(String errorCode) {
        return errorCode == null || !nonRetryableErrors.contains(errorCode);
    }

    public RetryPolicy withMaxRetries(int maxRetries) {
        return new RetryPolicy(maxRetries, strategyOrder, nonRetryableErrors);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxRetries = 3;
        private List<Strategy> strategyOrder = Strategy.defaultOrder();
        private Set<String> nonRetryableErrors = Set.of();

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder strategyOrder(List<Strategy> strategyOrder) {
            this.strategyOrder = strategyOrder;
            return this;
        }

        public Builder nonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxRetries, strategyOrder, nonRetryableErrors);
        }
    }
}
