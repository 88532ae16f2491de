package com.agentflow.advisory;

import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.exception.OrchestratorException;
import com.agentflow.core.model.AgentAttempt;
import com.agentflow.core.model.FailureSignature;
import com.agentflow.core.model.PipelineState;
import com.agentflow.core.model.StageTransition;
import com.agentflow.core.model.Strategy;
import com.agentflow.core.model.Subtask;
import com.agentflow.core.model.SubtaskGraph;
import com.agentflow.core.model.TaskStage;
import com.agentflow.core.repository.PipelineStateRepository;
import com.agentflow.engine.decomposition.Decomposer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Advisory service that works purely from persisted pipeline snapshots.
 *
 * Subtask capabilities are recovered by decomposing each archived task again; decomposition
 * is deterministic, so this yields the graph the pipeline ran with.
 */
public class HistoryAdvisoryService implements AdvisoryService {

    private static final Logger log = LoggerFactory.getLogger(HistoryAdvisoryService.class);

    private static final int MIN_PATTERN_OCCURRENCES = 2;
    private static final int MIN_SAMPLES_FOR_FULL_CONFIDENCE = 20;

    private final PipelineStateRepository repository;
    private final Decomposer decomposer;

    public HistoryAdvisoryService(PipelineStateRepository repository, Decomposer decomposer) {
        this.repository = repository;
        this.decomposer = decomposer;
    }

    // ========== Failure patterns ==========

    @Override
    public FailureAnalysisReport analyzeFailurePatterns(Instant since) {
        List<PipelineState> archived = repository.findArchivedSince(since);
        log.debug("Analyzing {} archived pipelines since {}", archived.size(), since);

        Map<FailureSignature, Integer> occurrences = new EnumMap<>(FailureSignature.class);
        Map<FailureSignature, Set<String>> pipelines = new EnumMap<>(FailureSignature.class);
        Map<FailureSignature, Set<String>> capabilities = new EnumMap<>(FailureSignature.class);
        int escalated = 0;
        int failed = 0;

        for (PipelineState state : archived) {
            if (state.stage() == TaskStage.ESCALATED) {
                escalated++;
            } else if (state.stage() == TaskStage.FAILED) {
                failed++;
            }
            Map<String, String> capabilityBySubtask = capabilitiesOf(state);
            for (AgentAttempt attempt : state.attempts()) {
                if (!attempt.isFailure() || attempt.errorClassification() == null) {
                    continue;
                }
                FailureSignature signature = attempt.errorClassification();
                occurrences.merge(signature, 1, Integer::sum);
                pipelines.computeIfAbsent(signature, s -> new TreeSet<>()).add(state.taskId());
                capabilities.computeIfAbsent(signature, s -> new TreeSet<>())
                    .add(capabilityBySubtask.getOrDefault(attempt.subtaskId(), "unknown"));
            }
        }

        List<FailurePattern> patterns = occurrences.entrySet().stream()
            .filter(e -> e.getValue() >= MIN_PATTERN_OCCURRENCES)
            .map(e -> new FailurePattern(
                e.getKey(),
                String.format("%s seen %d times across %d pipelines",
                    e.getKey().value(), e.getValue(), pipelines.get(e.getKey()).size()),
                e.getValue(),
                pipelines.get(e.getKey()).size(),
                List.copyOf(capabilities.get(e.getKey())),
                e.getKey().nextStepHint()))
            .sorted(Comparator.comparingInt(FailurePattern::occurrenceCount).reversed()
                .thenComparingInt(p -> p.signature().ordinal()))
            .toList();

        List<StrategyOscillation> oscillations = oscillationsIn(archived);
        List<String> recommendations = recommendations(archived.size(), escalated + failed, patterns, oscillations);

        String summary = String.format(
            "Analyzed %d pipelines: %d escalated, %d failed, %d recurring failure patterns, %d oscillating subtasks",
            archived.size(), escalated, failed, patterns.size(), oscillations.size());

        return new FailureAnalysisReport(since, archived.size(), escalated, failed,
            patterns, oscillations, recommendations, summary);
    }

    private List<String> recommendations(int analyzed, int unresolved, List<FailurePattern> patterns,
                                         List<StrategyOscillation> oscillations) {
        List<String> recommendations = new ArrayList<>();
        if (analyzed > 0 && unresolved * 2 > analyzed) {
            recommendations.add(String.format(
                "%d of %d pipelines ended unresolved; review how tasks are written before they are submitted",
                unresolved, analyzed));
        }
        for (FailurePattern pattern : patterns) {
            switch (pattern.signature()) {
                case TIMEOUT -> recommendations.add(
                    "Recurring timeouts: raise the subtask timeout or split large tasks");
                case ACCESS_DENIED -> recommendations.add(
                    "Recurring access errors: check worker credentials; retries cannot fix these");
                case MISSING_CURRENT_STATE, MISSING_TARGET_FILE, VAGUE_REQUIREMENTS -> recommendations.add(
                    "Recurring " + pattern.signature().value() + ": " + pattern.suggestedMitigation());
                default -> {
                }
            }
        }
        if (!oscillations.isEmpty()) {
            recommendations.add(String.format(
                "%d subtasks alternated between failure kinds; escalate such subtasks earlier",
                oscillations.size()));
        }
        return recommendations;
    }

    // ========== Oscillation ==========

    @Override
    public List<StrategyOscillation> detectStrategyOscillation(Instant since) {
        return oscillationsIn(repository.findArchivedSince(since));
    }

    private List<StrategyOscillation> oscillationsIn(List<PipelineState> states) {
        List<StrategyOscillation> found = new ArrayList<>();
        for (PipelineState state : states) {
            Map<String, List<AgentAttempt>> failuresBySubtask = state.attempts().stream()
                .filter(AgentAttempt::isFailure)
                .filter(a -> a.errorClassification() != null)
                .collect(Collectors.groupingBy(AgentAttempt::subtaskId, LinkedHashMap::new, Collectors.toList()));

            failuresBySubtask.forEach((subtaskId, failures) -> {
                List<FailureSignature> signatures = failures.stream().map(AgentAttempt::errorClassification).toList();
                if (alternates(signatures)) {
                    found.add(new StrategyOscillation(
                        state.taskId(),
                        subtaskId,
                        signatures,
                        failures.stream().map(AgentAttempt::strategy).toList(),
                        subtaskId + " alternated between failures: "
                            + signatures.stream().map(FailureSignature::value).collect(Collectors.joining(" -> "))));
                }
            });
        }
        return found;
    }

    /**
     * True when some signature recurs after a different one came in between (A, B, A).
     */
    static boolean alternates(List<FailureSignature> signatures) {
        for (int i = 0; i + 2 < signatures.size(); i++) {
            if (signatures.get(i) == signatures.get(i + 2) && signatures.get(i) != signatures.get(i + 1)) {
                return true;
            }
        }
        return false;
    }

    // ========== Explanation ==========

    @Override
    public String explainPipeline(String taskId) {
        PipelineState state = repository.findById(taskId)
            .orElseThrow(() -> new NotFoundException("Pipeline", taskId));

        StringBuilder sb = new StringBuilder();
        sb.append("Task ").append(taskId).append(" is ").append(state.stage());
        if (state.isArchived()) {
            sb.append(" (archived ").append(state.archivedAt()).append(')');
        }
        sb.append('\n');
        if (state.task() != null) {
            sb.append("Description: ").append(state.task().description()).append('\n');
            if (state.task().declaredComplexity() != null) {
                sb.append("Declared complexity: ").append(state.task().declaredComplexity()).append('\n');
            }
        }

        sb.append("Journey:\n");
        for (StageTransition transition : state.stageHistory()) {
            sb.append("  ").append(transition.at()).append(' ')
                .append(transition.from() != null ? transition.from() + " -> " : "")
                .append(transition.to());
            if (transition.reason() != null && !transition.reason().isBlank()) {
                sb.append(": ").append(transition.reason());
            }
            sb.append('\n');
        }

        sb.append("Attempts (").append(state.attempts().size()).append("), retries used ")
            .append(state.retryCount()).append('/').append(state.maxRetries()).append(":\n");
        for (AgentAttempt attempt : state.attempts()) {
            sb.append("  ").append(attempt.subtaskId())
                .append(" #").append(attempt.attemptNumber())
                .append(" [").append(attempt.strategy().value()).append("] ")
                .append(attempt.outcome());
            if (attempt.isFailure()) {
                FailureSignature signature = attempt.errorClassification();
                sb.append(" (").append(signature != null ? signature.value() : "unclassified").append(')');
                if (attempt.errorMessage() != null) {
                    sb.append(": ").append(attempt.errorMessage());
                }
            } else if (!attempt.touchedTargets().isEmpty()) {
                sb.append(" touched ").append(String.join(", ", attempt.touchedTargets()));
            }
            sb.append('\n');
        }

        if (!state.failurePatterns().isEmpty()) {
            sb.append("Failure patterns: ").append(state.failurePatterns().stream()
                .map(FailureSignature::value).collect(Collectors.joining(", "))).append('\n');
        }
        for (StrategyOscillation oscillation : oscillationsIn(List.of(state))) {
            sb.append("Oscillation: ").append(oscillation.description()).append('\n');
        }
        if (state.stage() == TaskStage.ESCALATED || state.stage() == TaskStage.FAILED) {
            FailureSignature dominant = dominant(state.attempts());
            sb.append("Recommended next step: ").append(dominant.nextStepHint()).append('\n');
        }
        return sb.toString();
    }

    // ========== Retry policy ==========

    @Override
    public RetryPolicySuggestion suggestRetryPolicy(Instant since) {
        List<PipelineState> archived = repository.findArchivedSince(since);
        Map<Strategy, Integer> recoveries = new EnumMap<>(Strategy.class);
        int samples = 0;
        int mostFailuresBeforeRecovery = 0;

        for (PipelineState state : archived) {
            Map<String, Integer> failuresSoFar = new HashMap<>();
            for (AgentAttempt attempt : state.attempts()) {
                int prior = failuresSoFar.getOrDefault(attempt.subtaskId(), 0);
                if (attempt.isFailure()) {
                    failuresSoFar.put(attempt.subtaskId(), prior + 1);
                } else if (prior > 0) {
                    recoveries.merge(attempt.strategy(), 1, Integer::sum);
                    mostFailuresBeforeRecovery = Math.max(mostFailuresBeforeRecovery, prior);
                    samples++;
                }
            }
        }

        if (samples == 0) {
            return new RetryPolicySuggestion(3, Strategy.defaultOrder(),
                "No recovered subtasks in the analyzed history; keeping the default policy", 0.0);
        }

        List<Strategy> retryOrder = new ArrayList<>(Strategy.defaultOrder());
        retryOrder.remove(Strategy.DIRECT);
        retryOrder.sort(Comparator.comparing((Strategy s) -> recoveries.getOrDefault(s, 0)).reversed()
            .thenComparingInt(Strategy::ordinal));
        List<Strategy> order = new ArrayList<>();
        order.add(Strategy.DIRECT);
        order.addAll(retryOrder);

        int maxRetries = Math.max(1, Math.min(mostFailuresBeforeRecovery, Strategy.values().length));
        String reasoning = String.format("%d subtasks recovered after failing; recoveries by strategy: %s; "
                + "the slowest recovery needed %d failed attempts",
            samples, recoveries, mostFailuresBeforeRecovery);
        double confidence = Math.min(1.0, (double) samples / MIN_SAMPLES_FOR_FULL_CONFIDENCE);
        return new RetryPolicySuggestion(maxRetries, List.copyOf(order), reasoning, confidence);
    }

    // ========== Internal ==========

    private Map<String, String> capabilitiesOf(PipelineState state) {
        Map<String, String> capabilities = new HashMap<>();
        if (state.task() == null) {
            return capabilities;
        }
        try {
            SubtaskGraph graph = decomposer.decompose(state.task());
            for (Subtask subtask : graph.subtasks()) {
                capabilities.put(subtask.subtaskId(), subtask.capability());
            }
        } catch (OrchestratorException e) {
            log.warn("Could not re-derive subtasks of {}: {}", state.taskId(), e.getMessage());
        }
        return capabilities;
    }

    private static FailureSignature dominant(List<AgentAttempt> attempts) {
        Map<FailureSignature, Integer> counts = new EnumMap<>(FailureSignature.class);
        FailureSignature dominant = FailureSignature.UNKNOWN;
        int best = 0;
        for (AgentAttempt attempt : attempts) {
            if (attempt.isFailure() && attempt.errorClassification() != null) {
                int count = counts.merge(attempt.errorClassification(), 1, Integer::sum);
                if (count >= best) {
                    best = count;
                    dominant = attempt.errorClassification();
                }
            }
        }
        return dominant;
    }
}
