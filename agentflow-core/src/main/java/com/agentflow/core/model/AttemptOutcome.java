package com.agentflow.core.model;

public enum AttemptOutcome {
    SUCCESS,
    FAILURE
}
