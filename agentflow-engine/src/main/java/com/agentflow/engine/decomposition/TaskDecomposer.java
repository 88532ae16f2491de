package com.agentflow.engine.decomposition;

import com.agentflow.core.model.ExecutionPattern;
import com.agentflow.core.model.Subtask;
import com.agentflow.core.model.SubtaskGraph;
import com.agentflow.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decomposes a task according to the execution pattern of its complexity tier.
 *
 * <ul>
 *   <li>SINGLE: one implementation subtask ({@code impl})</li>
 *   <li>PIPELINE: implementation then validation ({@code impl -> validate})</li>
 *   <li>FORK_JOIN: planning, N independent implementation subtasks, then one validation
 *       subtask joining them ({@code plan -> impl-1..impl-N -> validate})</li>
 * </ul>
 *
 * Fork-join fans out one implementation subtask per file target. Without at least two file
 * targets it fans out per enumerated requirement item instead. More units than
 * {@code maxFanOut} are grouped round-robin.
 */
public class TaskDecomposer implements Decomposer {

    private static final Logger log = LoggerFactory.getLogger(TaskDecomposer.class);

    public static final String SUFFIX_PLAN = "plan";
    public static final String SUFFIX_IMPL = "impl";
    public static final String SUFFIX_VALIDATE = "validate";

    private final ComplexityClassifier classifier;
    private final int maxFanOut;

    public TaskDecomposer(ComplexityClassifier classifier, int maxFanOut) {
        if (maxFanOut < 1) {
            throw new IllegalArgumentException("maxFanOut must be >= 1");
        }
        this.classifier = classifier;
        this.maxFanOut = maxFanOut;
    }

    @Override
    public SubtaskGraph decompose(Task task) {
        ComplexityAssessment assessment = classifier.classify(task);
        ExecutionPattern pattern = assessment.tier().pattern();
        log.info("Task {} classified as {} -> {}", task.taskId(), assessment.describe(), pattern);

        SubtaskGraph.Builder builder = SubtaskGraph.builder(task.taskId(), assessment.tier(), pattern);
        switch (pattern) {
            case SINGLE -> builder.add(implementation(task, SUFFIX_IMPL, assessment.fileTargets(), List.of(),
                task.description()));
            case PIPELINE -> {
                Subtask impl = implementation(task, SUFFIX_IMPL, assessment.fileTargets(), List.of(),
                    task.description());
                builder.add(impl);
                builder.add(validation(task, assessment.fileTargets(), List.of(impl.subtaskId())));
            }
            case FORK_JOIN -> forkJoin(task, assessment, builder);
        }
        return builder.build();
    }

    public ComplexityClassifier classifier() {
        return classifier;
    }

    // ========== Fork-join ==========

    private void forkJoin(Task task, ComplexityAssessment assessment, SubtaskGraph.Builder builder) {
        List<String> files = assessment.fileTargets();
        Subtask plan = Subtask.pending(task.taskId(), SUFFIX_PLAN,
            "Plan the change and confirm the affected areas: " + task.description(),
            Subtask.CAPABILITY_PLANNING, List.of(), files);
        builder.add(plan);

        List<String> implIds = new ArrayList<>();
        if (files.size() >= 2) {
            List<List<String>> groups = partition(files);
            for (int i = 0; i < groups.size(); i++) {
                List<String> group = groups.get(i);
                Subtask impl = implementation(task, SUFFIX_IMPL + "-" + (i + 1), group,
                    List.of(plan.subtaskId()),
                    "Implement the changes to " + String.join(", ", group) + ": " + task.description());
                builder.add(impl);
                implIds.add(impl.subtaskId());
            }
        } else if (assessment.requirementItems().size() >= 2) {
            List<List<String>> groups = partition(assessment.requirementItems());
            for (int i = 0; i < groups.size(); i++) {
                Subtask impl = implementation(task, SUFFIX_IMPL + "-" + (i + 1), files,
                    List.of(plan.subtaskId()),
                    "Implement: " + String.join("; ", groups.get(i)));
                builder.add(impl);
                implIds.add(impl.subtaskId());
            }
        } else {
            Subtask impl = implementation(task, SUFFIX_IMPL + "-1", files, List.of(plan.subtaskId()),
                task.description());
            builder.add(impl);
            implIds.add(impl.subtaskId());
        }

        builder.add(validation(task, files, implIds));
    }

    private List<List<String>> partition(List<String> units) {
        int groups = Math.min(units.size(), maxFanOut);
        List<List<String>> result = new ArrayList<>();
        for (int i = 0; i < groups; i++) {
            result.add(new ArrayList<>());
        }
        for (int i = 0; i < units.size(); i++) {
            result.get(i % groups).add(units.get(i));
        }
        return result;
    }

    private static Subtask implementation(Task task, String suffix, List<String> targets,
                                          List<String> dependsOn, String description) {
        return Subtask.pending(task.taskId(), suffix, description, Subtask.CAPABILITY_IMPLEMENTATION,
            dependsOn, targets);
    }

    private static Subtask validation(Task task, List<String> targets, List<String> dependsOn) {
        return Subtask.pending(task.taskId(), SUFFIX_VALIDATE,
            "Validate the combined change: " + task.description(),
            Subtask.CAPABILITY_VALIDATION, dependsOn, targets);
    }
}
