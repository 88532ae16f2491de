package com.agentflow.recovery;

import java.util.List;

/**
 * Outcome of one start-up recovery pass.
 *
 * @param resumed pipelines reloaded and handed back to the orchestrator
 * @param corrupt pipelines whose persisted history failed verification; left untouched
 * @param failed pipelines that could not be resumed for any other reason
 */
public record RecoveryReport(
    List<String> resumed,
    List<String> corrupt,
    List<String> failed
) {
    public RecoveryReport {
        resumed = List.copyOf(resumed);
        corrupt = List.copyOf(corrupt);
        failed = List.copyOf(failed);
    }

    public boolean isClean() {
        return corrupt.isEmpty() && failed.isEmpty();
    }
}
