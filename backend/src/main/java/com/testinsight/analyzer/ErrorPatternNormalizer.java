package com.testinsight.analyzer;

import com.testinsight.config.AnalyticsProperties.NormalizationRule;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduces an error message to a pattern key by replacing embedded literals with placeholders.
 */
public class ErrorPatternNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private record CompiledRule(Pattern pattern, String replacement) {}

    private final List<CompiledRule> rules;
    private final int maxLength;

    public ErrorPatternNormalizer(List<NormalizationRule> rules, int maxLength) {
        this.rules = rules.stream()
                .map(r -> new CompiledRule(Pattern.compile(r.getPattern()), Matcher.quoteReplacement(r.getReplacement())))
                .toList();
        this.maxLength = maxLength;
    }

    public String normalize(String message) {
        if (message == null) return "";
        String pattern = message;
        for (CompiledRule rule : rules) {
            pattern = rule.pattern().matcher(pattern).replaceAll(rule.replacement());
        }
        pattern = WHITESPACE.matcher(pattern).replaceAll(" ").trim();
        return pattern.length() > maxLength ? pattern.substring(0, maxLength) : pattern;
    }
}
