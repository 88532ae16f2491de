package com.agentflow.engine.event;

import com.agentflow.core.model.EscalationRecord;

/**
 * Outbound hand-offs of a finished pipeline: completed work to source-control integration,
 * escalations to the human-review sink.
 * Implementations must not throw; the pipeline is already terminal when they are called.
 */
public interface PipelineEventPublisher {

    void onReadyForIntegration(ReadyForIntegrationEvent event);

    void onEscalation(EscalationRecord record);
}
