package com.agentflow.engine.decomposition;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls structural signals out of a free-text task description:
 * file targets, enumerated requirement items and section headers.
 */
public final class TargetExtractor {

    private static final Pattern FILE_TARGET = Pattern.compile(
        "(?:^|[\\s\"'`(/])((?:[./]?[\\w/-]+/)?[\\w-]+\\."
            + "(?:py|js|ts|tsx|jsx|java|kt|go|rs|rb|md|txt|json|yaml|yml|toml|cfg|conf|xml|properties|sql|sh|bash|gitignore))"
            + "(?=$|[\\s\"'`),:;]|\\.(?:\\s|$))",
        Pattern.MULTILINE);

    private static final Pattern BULLET_ITEM = Pattern.compile("^\\s*[-*]\\s+(.+)$", Pattern.MULTILINE);
    private static final Pattern NUMBERED_ITEM = Pattern.compile("^\\s*\\d+[.)]\\s+(.+)$", Pattern.MULTILINE);
    private static final Pattern SECTION_HEADER = Pattern.compile("^\\s*#{1,6}\\s+(\\S.*)$", Pattern.MULTILINE);

    private TargetExtractor() {
    }

    /**
     * Distinct file targets in order of first mention.
     */
    public static List<String> fileTargets(String description) {
        Set<String> targets = new LinkedHashSet<>();
        Matcher matcher = FILE_TARGET.matcher(description);
        while (matcher.find()) {
            String target = matcher.group(1);
            if (target.startsWith("./")) {
                target = target.substring(2);
            }
            targets.add(target);
        }
        return List.copyOf(targets);
    }

    /**
     * Bulleted and numbered requirement items, bullets first.
     */
    public static List<String> requirementItems(String description) {
        List<String> items = new ArrayList<>();
        collect(BULLET_ITEM, description, items);
        collect(NUMBERED_ITEM, description, items);
        return items;
    }

    public static List<String> sectionHeaders(String description) {
        List<String> headers = new ArrayList<>();
        collect(SECTION_HEADER, description, headers);
        return headers;
    }

    private static void collect(Pattern pattern, String text, List<String> into) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            into.add(matcher.group(1).trim());
        }
    }
}
