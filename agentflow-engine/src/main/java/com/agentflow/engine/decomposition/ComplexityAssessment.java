package com.agentflow.engine.decomposition;

import com.agentflow.core.model.ComplexityTier;

import java.util.List;

/**
 * Result of classifying a task description.
 *
 * @param tier the tier used for decomposition
 * @param declared true when the tier came from the task source rather than from the signals
 * @param roundedDown true when ambiguous signals moved the tier one step down
 */
public record ComplexityAssessment(
    ComplexityTier tier,
    boolean declared,
    List<String> fileTargets,
    List<String> requirementItems,
    int sections,
    List<String> concerns,
    int score,
    boolean roundedDown
) {
    public ComplexityAssessment {
        fileTargets = fileTargets != null ? List.copyOf(fileTargets) : List.of();
        requirementItems = requirementItems != null ? List.copyOf(requirementItems) : List.of();
        concerns = concerns != null ? List.copyOf(concerns) : List.of();
    }

    public String describe() {
        return String.format("%s%s (score=%d, files=%d, sections=%d, concerns=%s%s)",
            tier, declared ? " [declared]" : "", score, fileTargets.size(), sections, concerns,
            roundedDown ? ", rounded down" : "");
    }
}
