package com.agentflow.engine.decomposition;

import com.agentflow.core.model.ComplexityTier;
import com.agentflow.core.model.Task;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Assigns a complexity tier to a task from structural signals in its description.
 *
 * Three signals are scored from 0 to 3 each: enumerated sections and requirement items,
 * distinct file targets, and distinct concern areas. The summed score maps to a tier.
 * When only one signal contributes to a tier of MODERATE or above the evidence is
 * ambiguous and the tier is lowered one step. A tier declared by the task source is
 * used as is.
 */
public class ComplexityClassifier {

    private static final Map<String, Pattern> CONCERNS = new LinkedHashMap<>();

    static {
        CONCERNS.put("api", keywords("api", "endpoint", "rest", "graphql", "route"));
        CONCERNS.put("database", keywords("database", "schema", "migration", "sql", "query", "table"));
        CONCERNS.put("ui", keywords("ui", "frontend", "component", "page", "css", "layout"));
        CONCERNS.put("security", keywords("security", "auth", "authentication", "authorization", "permission", "token"));
        CONCERNS.put("tests", keywords("test", "tests", "coverage", "unit test", "integration test"));
        CONCERNS.put("performance", keywords("performance", "latency", "cache", "caching", "optimize"));
        CONCERNS.put("docs", keywords("docs", "documentation", "readme", "changelog"));
        CONCERNS.put("config", keywords("config", "configuration", "environment", "settings", "deploy"));
    }

    private static final int SHORT_DESCRIPTION = 120;

    public ComplexityAssessment classify(Task task) {
        String description = task.description();
        List<String> files = TargetExtractor.fileTargets(description);
        List<String> items = TargetExtractor.requirementItems(description);
        int sections = items.size() + TargetExtractor.sectionHeaders(description).size();
        List<String> concerns = concerns(description);

        int fileScore = scoreFiles(files.size());
        int sectionScore = scoreSections(sections);
        int concernScore = scoreConcerns(concerns.size());
        int score = fileScore + sectionScore + concernScore;

        if (task.declaredComplexity() != null) {
            return new ComplexityAssessment(task.declaredComplexity(), true, files, items,
                sections, concerns, score, false);
        }

        ComplexityTier tier = tierFor(score, description);
        int contributing = (fileScore > 0 ? 1 : 0) + (sectionScore > 0 ? 1 : 0) + (concernScore > 0 ? 1 : 0);
        boolean roundedDown = false;
        if (tier.compareTo(ComplexityTier.MODERATE) >= 0 && contributing < 2) {
            tier = tier.lower();
            roundedDown = true;
        }
        return new ComplexityAssessment(tier, false, files, items, sections, concerns, score, roundedDown);
    }

    static int scoreFiles(int files) {
        if (files <= 1) {
            return 0;
        }
        if (files == 2) {
            return 1;
        }
        return files <= 5 ? 2 : 3;
    }

    static int scoreSections(int sections) {
        if (sections <= 1) {
            return 0;
        }
        if (sections <= 3) {
            return 1;
        }
        return sections <= 7 ? 2 : 3;
    }

    static int scoreConcerns(int concerns) {
        if (concerns <= 1) {
            return 0;
        }
        return Math.min(concerns - 1, 3);
    }

    private static ComplexityTier tierFor(int score, String description) {
        if (score == 0) {
            boolean shortText = description.strip().length() <= SHORT_DESCRIPTION && !description.strip().contains("\n");
            return shortText ? ComplexityTier.ATOMIC : ComplexityTier.SIMPLE;
        }
        if (score <= 2) {
            return ComplexityTier.SIMPLE;
        }
        if (score <= 4) {
            return ComplexityTier.MODERATE;
        }
        return score <= 7 ? ComplexityTier.COMPLEX : ComplexityTier.ENTERPRISE;
    }

    private static List<String> concerns(String description) {
        String text = description.toLowerCase(Locale.ROOT);
        List<String> found = new ArrayList<>();
        CONCERNS.forEach((concern, pattern) -> {
            if (pattern.matcher(text).find()) {
                found.add(concern);
            }
        });
        return found;
    }

    private static Pattern keywords(String... words) {
        return Pattern.compile("\\b(?:" + String.join("|", words) + ")\\b");
    }
}
