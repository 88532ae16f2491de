package com.agentflow.engine.event;

import com.agentflow.core.model.EscalationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publisher used when nothing downstream is wired: writes the hand-offs to the log.
 */
public class LoggingPipelineEventPublisher implements PipelineEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingPipelineEventPublisher.class);

    @Override
    public void onReadyForIntegration(ReadyForIntegrationEvent event) {
        log.info("Task {} ready for integration, touched targets: {}{}",
            event.taskId(), event.touchedTargets(),
            event.degradedSubtasks().isEmpty() ? "" : " (degraded: " + event.degradedSubtasks() + ")");
    }

    @Override
    public void onEscalation(EscalationRecord record) {
        log.warn("Escalation for task {}:\n{}", record.taskId(), record.toHumanReadable());
    }
}
