package com.agentflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Final outcome of executing a Task. Stage is always terminal.
 * Escalated verdicts always carry the escalation record with the full attempt history.
 */
public record Verdict(
    String taskId,
    TaskStage stage,
    Map<String, SubtaskStatus> subtaskStatuses,
    List<String> degradedSubtasks,
    int attemptCount,
    EscalationRecord escalation,
    String summary,
    Instant decidedAt
) {
    public Verdict {
        if (stage == null || !stage.isTerminal()) {
            throw new IllegalArgumentException("Verdict stage must be terminal, was " + stage);
        }
        subtaskStatuses = subtaskStatuses != null ? Map.copyOf(subtaskStatuses) : Map.of();
        degradedSubtasks = degradedSubtasks != null ? List.copyOf(degradedSubtasks) : List.of();
    }

    @JsonIgnore
    public boolean isComplete() {
        return stage == TaskStage.COMPLETE;
    }

    @JsonIgnore
    public boolean isEscalated() {
        return stage == TaskStage.ESCALATED;
    }

    @JsonIgnore
    public boolean isDegraded() {
        return stage == TaskStage.COMPLETE && !degradedSubtasks.isEmpty();
    }
}
