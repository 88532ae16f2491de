package com.agentflow.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Hand-off record for a Task that could not be resolved automatically.
 * Consumed by whatever sits behind the escalation sink: a human reviewer or a research workflow.
 */
public record EscalationRecord(
    String taskId,
    String description,
    String failedSubtaskId,
    String reason,
    List<AgentAttempt> attempts,
    List<FailureSignature> failureSignatures,
    List<String> touchedTargets,
    String recommendedNextStep,
    Instant escalatedAt
) {
    public EscalationRecord {
        attempts = attempts != null ? List.copyOf(attempts) : List.of();
        failureSignatures = failureSignatures != null ? List.copyOf(failureSignatures) : List.of();
        touchedTargets = touchedTargets != null ? List.copyOf(touchedTargets) : List.of();
    }

    /**
     * Plain-text account of the escalation for issue comments and review queues.
     */
    public String toHumanReadable() {
        StringBuilder sb = new StringBuilder();
        sb.append("Task ").append(taskId).append(" escalated: ").append(reason).append('\n');
        if (failedSubtaskId != null) {
            sb.append("Failed subtask: ").append(failedSubtaskId).append('\n');
        }
        sb.append("Description: ").append(description).append('\n');
        sb.append("Attempts (").append(attempts.size()).append("):\n");
        for (AgentAttempt attempt : attempts) {
            sb.append("  #").append(attempt.attemptNumber())
                .append(' ').append(attempt.subtaskId())
                .append(" [").append(attempt.strategy().value()).append("] ")
                .append(attempt.outcome());
            if (attempt.isFailure()) {
                FailureSignature signature = attempt.errorClassification();
                sb.append(" (").append(signature != null ? signature.value() : "unclassified").append(')');
                if (attempt.errorMessage() != null) {
                    sb.append(": ").append(attempt.errorMessage());
                }
            }
            sb.append('\n');
        }
        if (!failureSignatures.isEmpty()) {
            sb.append("Failure signatures: ")
                .append(String.join(", ", failureSignatures.stream().map(FailureSignature::value).toList()))
                .append('\n');
        }
        if (!touchedTargets.isEmpty()) {
            sb.append("Touched targets: ").append(String.join(", ", touchedTargets)).append('\n');
        }
        sb.append("Recommended next step: ").append(recommendedNextStep);
        return sb.toString();
    }
}
