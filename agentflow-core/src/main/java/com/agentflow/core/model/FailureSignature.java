package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse classification of why an attempt failed, accumulated across a Task's attempts.
 */
public enum FailureSignature {
    MISSING_CURRENT_STATE("missing-current-state",
        "Describe the current behavior and the expected behavior explicitly before retrying."),
    MISSING_TARGET_FILE("missing-target-file",
        "Name the file or module that should change."),
    VAGUE_REQUIREMENTS("vague-requirements",
        "Break the request into concrete acceptance criteria."),
    INVALID_FILE_PATH("invalid-file-path",
        "Verify the referenced paths exist in the repository."),
    ACCESS_DENIED("access-denied",
        "Check repository and service permissions for the worker."),
    SYNTAX_ERROR("syntax-error",
        "Review the generated change by hand; repeated syntax errors suggest an unsupported file type."),
    TEST_FAILURE("test-failure",
        "Inspect the failing tests; the expected behavior may conflict with existing tests."),
    TIMEOUT("timeout",
        "Split the work into smaller subtasks or raise the per-subtask timeout."),
    UNKNOWN("unknown",
        "Review the attempt history manually.");

    private final String value;
    private final String nextStepHint;

    FailureSignature(String value, String nextStepHint) {
        this.value = value;
        this.nextStepHint = nextStepHint;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Recommended action for a human picking up an escalation dominated by this signature.
     */
    public String nextStepHint() {
        return nextStepHint;
    }

    @JsonCreator
    public static FailureSignature fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Failure signature must not be null");
        }
        for (FailureSignature signature : values()) {
            if (signature.value.equalsIgnoreCase(value) || signature.name().equalsIgnoreCase(value)) {
                return signature;
            }
        }
        throw new IllegalArgumentException("Unknown failure signature: " + value);
    }
}
