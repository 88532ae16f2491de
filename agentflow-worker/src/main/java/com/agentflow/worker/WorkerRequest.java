package com.agentflow.worker;

import com.agentflow.core.model.AgentAttempt;
import com.agentflow.core.model.FailureSignature;
import com.agentflow.core.model.Strategy;
import com.agentflow.core.model.Subtask;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Input handed to a worker for one attempt: the subtask, the strategy to apply and
 * what was already tried for it.
 */
public class WorkerRequest {

    private final Subtask subtask;
    private final Strategy strategy;
    private final int attemptNumber;
    private final List<AgentAttempt> priorAttempts;

    public WorkerRequest(Subtask subtask, Strategy strategy, int attemptNumber, List<AgentAttempt> priorAttempts) {
        this.subtask = subtask;
        this.strategy = strategy;
        this.attemptNumber = attemptNumber;
        this.priorAttempts = priorAttempts != null ? List.copyOf(priorAttempts) : List.of();
    }

    public Subtask getSubtask() {
        return subtask;
    }

    public String getSubtaskId() {
        return subtask.subtaskId();
    }

    public String getTaskId() {
        return subtask.taskId();
    }

    public String getDescription() {
        return subtask.description();
    }

    public String getCapability() {
        return subtask.capability();
    }

    public List<String> getTargets() {
        return subtask.targets();
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public int getAttemptNumber() {
        return attemptNumber;
    }

    /**
     * Earlier attempts of this subtask, oldest first.
     */
    public List<AgentAttempt> getPriorAttempts() {
        return priorAttempts;
    }

    /**
     * Distinct failure signatures of earlier attempts, in the order first seen.
     */
    public Set<FailureSignature> getPriorFailureSignatures() {
        Set<FailureSignature> signatures = new LinkedHashSet<>();
        for (AgentAttempt attempt : priorAttempts) {
            if (attempt.errorClassification() != null) {
                signatures.add(attempt.errorClassification());
            }
        }
        return signatures;
    }

    /**
     * Key identifying this attempt. Use it when making external calls so a repeated
     * delivery of the same attempt can be recognized.
     */
    public String getIdempotencyKey() {
        return subtask.subtaskId() + ":" + attemptNumber;
    }
}
