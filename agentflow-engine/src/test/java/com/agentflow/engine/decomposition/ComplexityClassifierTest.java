package com.agentflow.engine.decomposition;

import com.agentflow.core.model.ComplexityTier;
import com.agentflow.core.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ComplexityClassifierTest {

    private final ComplexityClassifier classifier = new ComplexityClassifier();

    private static Task task(String description) {
        return Task.create("t1", description, null, Instant.EPOCH);
    }

    @Test
    @DisplayName("A one-line fix with no structure is atomic")
    void shortFixIsAtomic() {
        ComplexityAssessment assessment = classifier.classify(task("fix typo in README line 10"));

        assertThat(assessment.tier()).isEqualTo(ComplexityTier.ATOMIC);
        assertThat(assessment.fileTargets()).isEmpty();
        assertThat(assessment.declared()).isFalse();
    }

    @Test
    @DisplayName("Three files and two requirement items make a moderate task")
    void filesAndItemsIsModerate() {
        String description = """
            Update the retry handling in src/client.py, src/retry.py and src/config.yaml:
            - read the retry limit from the config file
            - log each retry
            """;

        ComplexityAssessment assessment = classifier.classify(task(description));

        assertThat(assessment.fileTargets()).containsExactly("src/client.py", "src/retry.py", "src/config.yaml");
        assertThat(assessment.requirementItems()).hasSize(2);
        assertThat(assessment.tier()).isEqualTo(ComplexityTier.MODERATE);
    }

    @Test
    @DisplayName("Many files, sections and concerns make a complex task")
    void richDescriptionIsComplex() {
        String description = """
            ## Summary
            Add token authentication to the REST api and cover it with tests.

            ## Changes
            1. Add middleware in app/auth.py
            2. Register the route in app/routes.py
            3. Store tokens in the database via app/models.py
            4. Document the flow in docs/auth.md
            """;

        ComplexityAssessment assessment = classifier.classify(task(description));

        assertThat(assessment.fileTargets()).hasSize(4);
        assertThat(assessment.concerns()).contains("api", "security", "database", "tests", "docs");
        assertThat(assessment.tier()).isIn(ComplexityTier.COMPLEX, ComplexityTier.ENTERPRISE);
    }

    @Test
    @DisplayName("A tier backed by a single signal is rounded down")
    void singleSignalRoundsDown() {
        // Six files, nothing else: score 3 would be MODERATE, lowered to SIMPLE
        String description = "Rename the helper in a.py b.py c.py d.py e.py f.py";

        ComplexityAssessment assessment = classifier.classify(task(description));

        assertThat(assessment.fileTargets()).hasSize(6);
        assertThat(assessment.roundedDown()).isTrue();
        assertThat(assessment.tier()).isEqualTo(ComplexityTier.SIMPLE);
    }

    @Test
    @DisplayName("A declared tier wins over the signals")
    void declaredTierWins() {
        Task task = Task.create("t1", "fix typo", ComplexityTier.COMPLEX, Instant.EPOCH);

        ComplexityAssessment assessment = classifier.classify(task);

        assertThat(assessment.tier()).isEqualTo(ComplexityTier.COMPLEX);
        assertThat(assessment.declared()).isTrue();
    }

    @Test
    @DisplayName("Long unstructured text is simple rather than atomic")
    void longUnstructuredIsSimple() {
        String description = "The dashboard sometimes shows stale numbers after a refresh.\n"
            + "It seems to happen only when the page was open overnight.";

        assertThat(classifier.classify(task(description)).tier()).isEqualTo(ComplexityTier.SIMPLE);
    }
}
