package com.agentflow.engine.decomposition;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TargetExtractorTest {

    @Test
    void fileTargets_shouldFindPathsAndDeduplicate() {
        List<String> targets = TargetExtractor.fileTargets(
            "Edit ./src/main.py and \"docs/guide.md\", then check src/main.py again.");

        assertEquals(List.of("src/main.py", "docs/guide.md"), targets);
    }

    @Test
    void fileTargets_shouldIgnoreWordsWithoutKnownExtension() {
        assertTrue(TargetExtractor.fileTargets("fix typo in README line 10").isEmpty());
        assertTrue(TargetExtractor.fileTargets("version 1.2 is out").isEmpty());
    }

    @Test
    void requirementItems_shouldCollectBulletsAndNumbers() {
        String description = """
            Steps:
            - first bullet
            * second bullet
            1. first number
            2) second number
            """;

        assertEquals(
            List.of("first bullet", "second bullet", "first number", "second number"),
            TargetExtractor.requirementItems(description));
    }

    @Test
    void sectionHeaders_shouldCollectMarkdownHeaders() {
        assertEquals(List.of("Summary", "Details"),
            TargetExtractor.sectionHeaders("# Summary\ntext\n### Details\nmore"));
    }
}
