package com.agentflow.engine.tracker;

import com.agentflow.core.model.AgentAttempt;
import com.agentflow.core.model.FailureSignature;
import com.agentflow.core.model.Task;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps a failed attempt to a {@link FailureSignature}.
 *
 * Detectors run in order against the worker's error code, message and payload; the first
 * match wins. {@link FailureSignature#TIMEOUT} comes only from a dispatch that timed out
 * ({@link #TIMEOUT_CODE}), never from message text. "Could not determine" failures are
 * refined by looking at the task description: a description with no current/expected
 * behavior, then one with no file reference, then a vague one.
 */
public class FailureClassifier {

    public static final String TIMEOUT_CODE = "TIMEOUT";

    private static final Pattern FILE_REFERENCE = Pattern.compile("[/\\w.-]+\\.\\w+");

    private record Detector(FailureSignature signature, List<String> phrases) {
        boolean matches(String text) {
            return phrases.stream().anyMatch(text::contains);
        }
    }

    private static final List<Detector> DETECTORS = List.of(
        new Detector(FailureSignature.MISSING_CURRENT_STATE, List.of("current state")),
        new Detector(FailureSignature.MISSING_TARGET_FILE,
            List.of("no target file", "target file", "which file", "no file specified")),
        new Detector(FailureSignature.VAGUE_REQUIREMENTS, List.of("vague", "unclear", "ambiguous", "insufficient detail")),
        new Detector(FailureSignature.INVALID_FILE_PATH, List.of("file not found", "no such file", "does not exist")),
        new Detector(FailureSignature.ACCESS_DENIED, List.of("permission", "access denied", "forbidden", "unauthorized")),
        new Detector(FailureSignature.SYNTAX_ERROR, List.of("syntax", "parse error", "unexpected token", "indentation")),
        new Detector(FailureSignature.TEST_FAILURE, List.of("test failed", "tests failed", "assertion", "failing test"))
    );

    public FailureSignature classify(AgentAttempt attempt, Task task) {
        if (TIMEOUT_CODE.equals(attempt.errorCode())) {
            return FailureSignature.TIMEOUT;
        }
        String text = failureText(attempt);
        if (text.contains("could not determine")) {
            return refineUndetermined(task);
        }
        for (Detector detector : DETECTORS) {
            if (detector.matches(text)) {
                return detector.signature();
            }
        }
        return FailureSignature.UNKNOWN;
    }

    private static FailureSignature refineUndetermined(Task task) {
        String description = task != null ? task.description() : "";
        String lower = description.toLowerCase(Locale.ROOT);
        if (!lower.contains("current") || !lower.contains("should")) {
            return FailureSignature.MISSING_CURRENT_STATE;
        }
        if (!FILE_REFERENCE.matcher(description).find()) {
            return FailureSignature.MISSING_TARGET_FILE;
        }
        return FailureSignature.VAGUE_REQUIREMENTS;
    }

    private static String failureText(AgentAttempt attempt) {
        StringBuilder sb = new StringBuilder();
        if (attempt.errorCode() != null) {
            sb.append(attempt.errorCode().replace('_', ' ')).append(' ');
        }
        if (attempt.errorMessage() != null) {
            sb.append(attempt.errorMessage()).append(' ');
        }
        if (attempt.payload() != null && !attempt.payload().isNull()) {
            sb.append(attempt.payload().toString());
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
