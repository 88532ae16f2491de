package com.agentflow.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskStageTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStages() {
        assertTrue(TaskStage.COMPLETE.isTerminal());
        assertTrue(TaskStage.FAILED.isTerminal());
        assertTrue(TaskStage.ESCALATED.isTerminal());
        assertTrue(TaskStage.CANCELLED.isTerminal());

        assertFalse(TaskStage.SUBMITTED.isTerminal());
        assertFalse(TaskStage.ROUTING.isTerminal());
        assertFalse(TaskStage.IMPLEMENTING.isTerminal());
        assertFalse(TaskStage.REVIEWING.isTerminal());
        assertFalse(TaskStage.TESTING.isTerminal());
    }

    @Test
    void canTransitionTo_fromSubmitted_shouldOnlyAllowRouting() {
        assertTrue(TaskStage.SUBMITTED.canTransitionTo(TaskStage.ROUTING));
        assertTrue(TaskStage.SUBMITTED.canTransitionTo(TaskStage.CANCELLED));

        assertFalse(TaskStage.SUBMITTED.canTransitionTo(TaskStage.IMPLEMENTING));
        assertFalse(TaskStage.SUBMITTED.canTransitionTo(TaskStage.COMPLETE));
        assertFalse(TaskStage.SUBMITTED.canTransitionTo(TaskStage.ESCALATED));
    }

    @Test
    void canTransitionTo_fromImplementing_shouldAllowForwardAndTerminal() {
        assertTrue(TaskStage.IMPLEMENTING.canTransitionTo(TaskStage.REVIEWING));
        assertTrue(TaskStage.IMPLEMENTING.canTransitionTo(TaskStage.TESTING));
        assertTrue(TaskStage.IMPLEMENTING.canTransitionTo(TaskStage.COMPLETE));
        assertTrue(TaskStage.IMPLEMENTING.canTransitionTo(TaskStage.ESCALATED));

        assertFalse(TaskStage.IMPLEMENTING.canTransitionTo(TaskStage.ROUTING));
        assertFalse(TaskStage.IMPLEMENTING.canTransitionTo(TaskStage.SUBMITTED));
    }

    @Test
    void canTransitionTo_fromTesting_shouldNotGoBack() {
        assertFalse(TaskStage.TESTING.canTransitionTo(TaskStage.IMPLEMENTING));
        assertFalse(TaskStage.TESTING.canTransitionTo(TaskStage.REVIEWING));
        assertTrue(TaskStage.TESTING.canTransitionTo(TaskStage.COMPLETE));
    }

    @Test
    void canTransitionTo_fromTerminal_shouldAllowNothing() {
        for (TaskStage terminal : new TaskStage[]{TaskStage.COMPLETE, TaskStage.FAILED,
                TaskStage.ESCALATED, TaskStage.CANCELLED}) {
            for (TaskStage target : TaskStage.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
    }

    @Test
    void subtaskStatus_runningMayReturnToReadyForRetry() {
        assertTrue(SubtaskStatus.RUNNING.canTransitionTo(SubtaskStatus.READY));
        assertTrue(SubtaskStatus.PENDING.canTransitionTo(SubtaskStatus.SKIPPED));

        assertFalse(SubtaskStatus.PENDING.canTransitionTo(SubtaskStatus.RUNNING));
        assertFalse(SubtaskStatus.RUNNING.canTransitionTo(SubtaskStatus.SKIPPED));
        assertFalse(SubtaskStatus.FAILED.canTransitionTo(SubtaskStatus.READY));
    }

    @Test
    void complexityTier_shouldMapToPatterns() {
        assertEquals(ExecutionPattern.SINGLE, ComplexityTier.ATOMIC.pattern());
        assertEquals(ExecutionPattern.SINGLE, ComplexityTier.SIMPLE.pattern());
        assertEquals(ExecutionPattern.PIPELINE, ComplexityTier.MODERATE.pattern());
        assertEquals(ExecutionPattern.FORK_JOIN, ComplexityTier.COMPLEX.pattern());
        assertEquals(ExecutionPattern.FORK_JOIN, ComplexityTier.ENTERPRISE.pattern());

        assertEquals(ComplexityTier.MODERATE, ComplexityTier.COMPLEX.lower());
        assertEquals(ComplexityTier.ATOMIC, ComplexityTier.ATOMIC.lower());
    }

    @Test
    void strategy_fromValue_shouldAcceptWireAndConstantNames() {
        assertEquals(Strategy.MECHANICAL_FIX, Strategy.fromValue("mechanical-fix"));
        assertEquals(Strategy.MECHANICAL_FIX, Strategy.fromValue("MECHANICAL_FIX"));
        assertEquals(Strategy.SIMPLIFY, Strategy.fromValue("Simplify"));

        assertThrows(IllegalArgumentException.class, () -> Strategy.fromValue("rewrite"));
        assertThrows(IllegalArgumentException.class, () -> Strategy.fromValue(null));
    }
}
