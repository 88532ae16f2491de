package com.agentflow.core.exception;

import java.util.List;

/**
 * Thrown when a subtask graph is malformed: duplicate ids, dangling dependencies or a cycle.
 */
public class GraphValidationException extends OrchestratorException {

    public static final String ERROR_CODE = "INVALID_GRAPH";

    private final List<String> violations;

    public GraphValidationException(String taskId, List<String> violations) {
        super(ERROR_CODE, taskId, String.format(
            "Invalid subtask graph for task %s: %s",
            taskId, String.join("; ", violations)
        ), null);
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
