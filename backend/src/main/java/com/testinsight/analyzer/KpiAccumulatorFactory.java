package com.testinsight.analyzer;

import com.testinsight.config.AnalyticsProperties;
import com.testinsight.model.enums.KpiType;
import com.testinsight.source.SourceBrowser;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Creates a fresh accumulator per KPI per job.
 */
@Component
@RequiredArgsConstructor
public class KpiAccumulatorFactory {

    private final KeywordLibraryResolver resolver;
    private final SourceBrowser sourceBrowser;
    private final AnalyticsProperties properties;

    public KpiAccumulator<?> create(KpiType type, UUID repositoryId) {
        AnalyticsProperties.Redundancy redundancy = properties.getRedundancy();
        return switch (type) {
            case KEYWORD_FREQUENCY -> new KeywordFrequencyAccumulator(resolver, properties.getTopKeywords());
            case KEYWORD_DURATION_IMPACT -> new KeywordDurationAccumulator(resolver, properties.getTopDurationKeywords());
            case LIBRARY_DISTRIBUTION -> new LibraryDistributionAccumulator(resolver);
            case TEST_COMPLEXITY -> new TestComplexityAccumulator(properties.getStepBuckets());
            case ASSERTION_DENSITY -> new AssertionDensityAccumulator(resolver, properties.getAssertionPrefixes(),
                    properties.getZeroAssertionTests());
            case TAG_COVERAGE -> new TagCoverageAccumulator(properties.getTopTags());
            case ERROR_PATTERNS -> new ErrorPatternAccumulator(
                    new ErrorPatternNormalizer(properties.getErrorNormalization(), properties.getErrorPatternMaxLength()),
                    properties.getMaxErrorPatterns(), properties.getErrorExamples());
            case REDUNDANCY_DETECTION -> new RedundancyAccumulator(redundancy.getMinLength(), redundancy.getMaxLength(),
                    redundancy.getMaxResults(), redundancy.getMaxTestsListed());
            case SOURCE_TEST_STATS -> new SourceTestStatsAccumulator(sourceBrowser, repositoryId, resolver,
                    properties.getStepBuckets(), properties.getTopKeywords());
            case SOURCE_LIBRARY_DISTRIBUTION -> new SourceLibraryAccumulator(sourceBrowser, repositoryId, resolver);
            case TEST_PASS_RATE_TREND -> new PassRateAccumulator();
            case SLOWEST_TESTS -> new SlowestTestsAccumulator();
            case FLAKINESS_SCORE -> new FlakinessScoreAccumulator();
            case FAILURE_HEATMAP -> new FailureHeatmapAccumulator();
            case SUITE_DURATION_TREEMAP -> new SuiteDurationAccumulator();
        };
    }
}
