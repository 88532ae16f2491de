package com.agentflow.core.model;

import java.time.Instant;

/**
 * One entry of a pipeline's stage history. {@code from} is null for the initial SUBMITTED entry.
 */
public record StageTransition(
    TaskStage from,
    TaskStage to,
    Instant at,
    String reason
) {
}
