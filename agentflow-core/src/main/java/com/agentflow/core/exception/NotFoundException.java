package com.agentflow.core.exception;

/**
 * Thrown when a pipeline, subtask or worker capability is not found.
 */
public class NotFoundException extends OrchestratorException {

    public static final String ERROR_CODE = "NOT_FOUND";

    private final String entityType;

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
        this.entityType = entityType;
    }

    public String getEntityType() {
        return entityType;
    }
}
