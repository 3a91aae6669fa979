package com.testinsight.config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Tuning knobs for the aggregation engine and the deep-analysis KPIs.
 *
 * <p>The defaults reproduce the documented bucket and normalization examples.
 */
@ConfigurationProperties(prefix = "testinsight.analytics")
@Getter
@Setter
public class AnalyticsProperties {

    /** Lookback windows (days) accepted by the overview endpoints. */
    private List<Integer> allowedWindows = new ArrayList<>(List.of(7, 14, 30, 90, 365));

    private int topKeywords = 50;
    private int topDurationKeywords = 30;
    private int topTags = 50;
    private int maxErrorPatterns = 20;
    private int errorExamples = 5;
    private int errorPatternMaxLength = 200;
    private int zeroAssertionTests = 20;

    /** Inclusive upper bounds of the step histogram; one extra open-ended bucket follows the last. */
    private List<Integer> stepBuckets = new ArrayList<>(List.of(5, 10, 20, 50));

    /** Keyword name prefixes (whole word, case-insensitive) that mark an assertion. */
    private List<String> assertionPrefixes = new ArrayList<>(List.of("should", "verify", "must"));

    /** Applied in order to an error message to form its pattern key. */
    private List<NormalizationRule> errorNormalization = new ArrayList<>(List.of(
            new NormalizationRule("[A-Za-z]:\\\\[^\\s]+|(?<![\\w<])/[^\\s'\"]+", "<path>"),
            new NormalizationRule("\\b\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}\\S*", "<ts>"),
            new NormalizationRule("'[^']*'|\"[^\"]*\"", "<str>"),
            new NormalizationRule("[$@&%]\\{[^}]*}", "<var>"),
            new NormalizationRule("\\b0x[0-9a-fA-F]+\\b", "<hex>"),
            new NormalizationRule("\\b\\d+(\\.\\d+)?\\b", "<N>")
    ));

    private int workerPoolSize = 4;
    private int workerQueueCapacity = 100;

    private final Redundancy redundancy = new Redundancy();
    private final Source source = new Source();

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NormalizationRule {
        private String pattern;
        private String replacement;
    }

    @Getter
    @Setter
    public static class Redundancy {
        private int minLength = 3;
        private int maxLength = 5;
        private int maxResults = 20;
        private int maxTestsListed = 10;
    }

    @Getter
    @Setter
    public static class Source {
        /** Repository id to the local checkout scanned for test-suite sources. */
        private Map<UUID, String> repositories = new HashMap<>();
    }
}
