package com.agentflow.core.model;

/**
 * Declared or classified complexity of a Task, ordered from least to most decomposed.
 */
public enum ComplexityTier {
    ATOMIC,
    SIMPLE,
    MODERATE,
    COMPLEX,
    ENTERPRISE;

    /**
     * The execution pattern this tier maps to.
     */
    public ExecutionPattern pattern() {
        return switch (this) {
            case ATOMIC, SIMPLE -> ExecutionPattern.SINGLE;
            case MODERATE -> ExecutionPattern.PIPELINE;
            case COMPLEX, ENTERPRISE -> ExecutionPattern.FORK_JOIN;
        };
    }

    /**
     * The next less-decomposed tier, or this tier if already the lowest.
     */
    public ComplexityTier lower() {
        return this == ATOMIC ? ATOMIC : values()[ordinal() - 1];
    }
}
