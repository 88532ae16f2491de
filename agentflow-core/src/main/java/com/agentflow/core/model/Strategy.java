package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Approach a worker is asked to take on an attempt.
 * Later strategies are used only after earlier ones failed for the same subtask.
 */
public enum Strategy {
    /** Carry out the subtask as described. */
    DIRECT("direct"),
    /** Repair the previous output in place: formatting, imports, obvious slips. */
    MECHANICAL_FIX("mechanical-fix"),
    /** Discard the previous output and start over with the failure context. */
    REGENERATE("regenerate"),
    /** Reduce scope to the smallest change that still satisfies the description. */
    SIMPLIFY("simplify");

    private final String value;

    Strategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parse a wire value ("mechanical-fix") or constant name ("MECHANICAL_FIX").
     *
     * @throws IllegalArgumentException for anything else
     */
    @JsonCreator
    public static Strategy fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Strategy must not be null");
        }
        for (Strategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(value) || strategy.name().equalsIgnoreCase(value)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown strategy: " + value);
    }

    public static List<Strategy> defaultOrder() {
        return List.of(DIRECT, MECHANICAL_FIX, REGENERATE, SIMPLIFY);
    }
}
