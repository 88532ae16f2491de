package com.agentflow.engine.tracker;

import com.agentflow.core.model.AgentAttempt;
import com.agentflow.core.model.FailureSignature;
import com.agentflow.core.model.Strategy;
import com.agentflow.core.model.Task;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FailureClassifierTest {

    private final FailureClassifier classifier = new FailureClassifier();

    private static final Task VAGUE_TASK = Task.create("t", "make it better", null, Instant.EPOCH);
    private static final Task STATED_TASK = Task.create("t",
        "The current output is wrong; it should print the total", null, Instant.EPOCH);
    private static final Task STATED_WITH_FILE = Task.create("t",
        "The current output of report.py is wrong; it should print the total", null, Instant.EPOCH);

    private static AgentAttempt failure(String code, String message) {
        return AgentAttempt.failure("t:impl", 1, Strategy.DIRECT, Instant.EPOCH, Instant.EPOCH, code, message, null);
    }

    @Test
    void classify_timeoutCodeWins() {
        assertEquals(FailureSignature.TIMEOUT,
            classifier.classify(failure("TIMEOUT", "syntax error somewhere"), STATED_TASK));
    }

    @Test
    void classify_couldNotDetermine_refinedByTaskDescription() {
        AgentAttempt attempt = failure("AGENT_FAILED", "Could not determine how to fix this issue");

        assertEquals(FailureSignature.MISSING_CURRENT_STATE, classifier.classify(attempt, VAGUE_TASK));
        assertEquals(FailureSignature.MISSING_TARGET_FILE, classifier.classify(attempt, STATED_TASK));
        assertEquals(FailureSignature.VAGUE_REQUIREMENTS, classifier.classify(attempt, STATED_WITH_FILE));
    }

    @Test
    void classify_detectorsMatchMessages() {
        assertEquals(FailureSignature.INVALID_FILE_PATH,
            classifier.classify(failure(null, "File not found: src/x.py"), STATED_TASK));
        assertEquals(FailureSignature.ACCESS_DENIED,
            classifier.classify(failure(null, "Permission denied for push"), STATED_TASK));
        assertEquals(FailureSignature.SYNTAX_ERROR,
            classifier.classify(failure(null, "SyntaxError: unexpected token"), STATED_TASK));
        assertEquals(FailureSignature.TEST_FAILURE,
            classifier.classify(failure(null, "2 tests failed"), STATED_TASK));
        assertEquals(FailureSignature.VAGUE_REQUIREMENTS,
            classifier.classify(failure(null, "The request is ambiguous"), STATED_TASK));
    }

    @Test
    void classify_currentStatePhraseIsMissingCurrentState() {
        assertEquals(FailureSignature.MISSING_CURRENT_STATE,
            classifier.classify(failure(null, "cannot infer the current state of the module"), STATED_TASK));
        assertEquals(FailureSignature.MISSING_TARGET_FILE,
            classifier.classify(failure(null, "no target file given"), STATED_TASK));
    }

    @Test
    void classify_earlierDetectorWinsWhenSeveralMatch() {
        assertEquals(FailureSignature.VAGUE_REQUIREMENTS,
            classifier.classify(failure(null, "requirements unclear; file not found"), STATED_TASK));
        assertEquals(FailureSignature.INVALID_FILE_PATH,
            classifier.classify(failure(null, "no such file; permission denied"), STATED_TASK));
        assertEquals(FailureSignature.SYNTAX_ERROR,
            classifier.classify(failure(null, "syntax error made 3 tests failed"), STATED_TASK));
    }

    @Test
    void classify_timeoutTextWithoutTimeoutCodeIsNotTimeout() {
        assertEquals(FailureSignature.TEST_FAILURE,
            classifier.classify(failure("AGENT_FAILED", "test failed: timeout waiting for socket"), STATED_TASK));
        assertEquals(FailureSignature.UNKNOWN,
            classifier.classify(failure("AGENT_FAILED", "deadline exceeded"), STATED_TASK));
    }

    @Test
    void classify_readsPayload() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("stderr", "AssertionError in test_total");
        AgentAttempt attempt = AgentAttempt.failure("t:impl", 1, Strategy.DIRECT,
            Instant.EPOCH, Instant.EPOCH, "AGENT_FAILED", "validation failed", payload);

        assertEquals(FailureSignature.TEST_FAILURE, classifier.classify(attempt, STATED_TASK));
    }

    @Test
    void classify_unmatchedIsUnknown() {
        assertEquals(FailureSignature.UNKNOWN,
            classifier.classify(failure("E42", "something odd happened"), STATED_TASK));
    }
}
