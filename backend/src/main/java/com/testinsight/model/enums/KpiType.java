package com.testinsight.model.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Catalog of deep-analysis KPIs. The {@code id} is the wire identifier clients select by.
 */
public enum KpiType {

    KEYWORD_FREQUENCY("keyword_frequency", KpiCategory.KEYWORDS, "Keyword Frequency",
            "Most used keywords ranked by call count"),
    KEYWORD_DURATION_IMPACT("keyword_duration_impact", KpiCategory.KEYWORDS, "Keyword Duration Impact",
            "Keywords ranked by cumulative execution time"),
    LIBRARY_DISTRIBUTION("library_distribution", KpiCategory.KEYWORDS, "Library Distribution",
            "Keyword calls distributed across libraries"),
    TEST_COMPLEXITY("test_complexity", KpiCategory.QUALITY, "Test Complexity",
            "Top-level steps per test with histogram"),
    ASSERTION_DENSITY("assertion_density", KpiCategory.QUALITY, "Assertion Density",
            "Share of assertion keywords per test"),
    TAG_COVERAGE("tag_coverage", KpiCategory.QUALITY, "Tag Coverage",
            "Tag usage, untagged tests and tags per test"),
    ERROR_PATTERNS("error_patterns", KpiCategory.MAINTENANCE, "Error Patterns",
            "Failure messages clustered by normalized pattern"),
    REDUNDANCY_DETECTION("redundancy_detection", KpiCategory.MAINTENANCE, "Redundancy Detection",
            "Keyword sequences repeated across tests"),
    SOURCE_TEST_STATS("source_test_stats", KpiCategory.SOURCE, "Source Test Statistics",
            "Test counts, steps and lines parsed from suite sources"),
    SOURCE_LIBRARY_DISTRIBUTION("source_library_distribution", KpiCategory.SOURCE, "Source Library Imports",
            "Library imports per file in suite sources"),
    TEST_PASS_RATE_TREND("test_pass_rate_trend", KpiCategory.EXECUTION, "Test Pass Rate",
            "Pass/fail counts per test, worst first"),
    SLOWEST_TESTS("slowest_tests", KpiCategory.EXECUTION, "Slowest Tests",
            "Tests with the highest average duration"),
    FLAKINESS_SCORE("flakiness_score", KpiCategory.EXECUTION, "Flakiness Score",
            "Status transitions per test in chronological order"),
    FAILURE_HEATMAP("failure_heatmap", KpiCategory.EXECUTION, "Failure Heatmap",
            "Most failing tests by day"),
    SUITE_DURATION_TREEMAP("suite_duration_treemap", KpiCategory.EXECUTION, "Suite Duration",
            "Execution time consumed per suite");

    private final String id;
    private final KpiCategory category;
    private final String displayName;
    private final String description;

    KpiType(String id, KpiCategory category, String displayName, String description) {
        this.id = id;
        this.category = category;
        this.displayName = displayName;
        this.description = description;
    }

    public String getId() {
        return id;
    }

    public KpiCategory getCategory() {
        return category;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    /** Source KPIs read the repository checkout instead of run reports. */
    public boolean needsReports() {
        return category != KpiCategory.SOURCE;
    }

    public static Optional<KpiType> fromId(String id) {
        if (id == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(k -> k.id.equals(id))
                .findFirst();
    }
}
