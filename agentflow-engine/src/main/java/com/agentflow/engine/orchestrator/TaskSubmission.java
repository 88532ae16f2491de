package com.agentflow.engine.orchestrator;

import com.agentflow.core.model.ComplexityTier;

/**
 * A task as handed over by an issue source.
 *
 * @param taskId stable id from the source, or null to have one generated
 * @param declaredComplexity tier declared by the source, or null to classify the description
 */
public record TaskSubmission(
    String taskId,
    String description,
    ComplexityTier declaredComplexity
) {
    public static TaskSubmission of(String description) {
        return new TaskSubmission(null, description, null);
    }

    public static TaskSubmission of(String taskId, String description) {
        return new TaskSubmission(taskId, description, null);
    }
}
