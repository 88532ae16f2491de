package com.agentflow.advisory;

import com.agentflow.core.model.FailureSignature;
import com.agentflow.core.model.Strategy;

import java.time.Instant;
import java.util.List;

/**
 * Advisory service over recorded pipeline history.
 *
 * This service is READ-ONLY. It observes archived pipelines and produces recommendations,
 * but never changes pipeline state. Recommendations are applied through configuration or
 * the task API by an operator.
 */
public interface AdvisoryService {

    /**
     * Aggregate failures of pipelines archived since the given instant into recurring patterns.
     *
     * @param since lower bound on archive time, inclusive
     * @return report with patterns, oscillating subtasks and recommendations
     */
    FailureAnalysisReport analyzeFailurePatterns(Instant since);

    /**
     * Subtasks whose failure signatures alternate, e.g. syntax-error, test-failure, syntax-error.
     * A fix for one problem reintroduces the other; retrying further rarely helps.
     */
    List<StrategyOscillation> detectStrategyOscillation(Instant since);

    /**
     * Human-readable account of one pipeline's journey: stages, attempts and outcome.
     *
     * @throws com.agentflow.core.exception.NotFoundException if no pipeline exists for the id
     */
    String explainPipeline(String taskId);

    /**
     * Suggest a retry ceiling and strategy order from which strategies actually recovered
     * failed subtasks.
     */
    RetryPolicySuggestion suggestRetryPolicy(Instant since);

    /**
     * Report on failure patterns.
     */
    record FailureAnalysisReport(
        Instant since,
        int analyzedPipelines,
        int escalatedPipelines,
        int failedPipelines,
        List<FailurePattern> patterns,
        List<StrategyOscillation> oscillations,
        List<String> recommendations,
        String summary
    ) {}

    /**
     * A failure signature seen repeatedly.
     */
    record FailurePattern(
        FailureSignature signature,
        String description,
        int occurrenceCount,
        int affectedPipelines,
        List<String> affectedCapabilities,
        String suggestedMitigation
    ) {}

    record StrategyOscillation(
        String taskId,
        String subtaskId,
        List<FailureSignature> signatures,
        List<Strategy> strategies,
        String description
    ) {}

    /**
     * Suggested retry configuration. A suggestion only; nothing applies it automatically.
     */
    record RetryPolicySuggestion(
        int suggestedMaxRetries,
        List<Strategy> suggestedStrategyOrder,
        String reasoning,
        double confidence
    ) {}
}
