package com.testinsight.analyzer;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

import static com.testinsight.model.enums.TestStatus.FAIL;
import static com.testinsight.model.enums.TestStatus.PASS;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Folding the same reports in a different order must give the same result.
 */
class OrderIndependenceTest {

    private static KeywordLibraryResolver resolver;
    private static List<ReportData> reports;

    @BeforeAll
    static void setUp() {
        resolver = new KeywordLibraryResolver(new ObjectMapper());
        reports = List.of(
                Reports.run(0)
                        .test("Login", "Auth", PASS, 1.2, null, List.of("smoke", "auth"),
                                "Open Browser", "Input Text", "Click Button")
                        .keyword("Login", "BuiltIn.Log", null, 1, 0.01)
                        .build(),
                Reports.run(1)
                        .test("Login", "Auth", FAIL, 2.4, "Expected 1 but got 2", List.of("smoke"),
                                "Open Browser", "Should Be Equal")
                        .test("Search", "Shop", PASS, 0.3, null, List.of(), "Custom Step", "Log")
                        .build(),
                Reports.run(2)
                        .test("Checkout", "Shop", PASS, 4.0, null, List.of("regression", "smoke"),
                                "Create Session", "Log", "Log")
                        .keyword("Checkout", "Input Text", "SeleniumLibrary", 0, 0.2)
                        .build(),
                Reports.run(3)
                        .test("Search", "Shop", PASS, 0.4, null, List.of("regression"),
                                "Custom Step", "Should Contain")
                        .build());
    }

    @Test
    void keywordFrequency_IsOrderIndependent() {
        assertSameForEveryOrder(() -> new KeywordFrequencyAccumulator(resolver, 50));
    }

    @Test
    void libraryDistribution_IsOrderIndependent() {
        assertSameForEveryOrder(() -> new LibraryDistributionAccumulator(resolver));
    }

    @Test
    void tagCoverage_IsOrderIndependent() {
        assertSameForEveryOrder(() -> new TagCoverageAccumulator(50));
    }

    @Test
    void executionKpis_AreOrderIndependent() {
        assertSameForEveryOrder(SlowestTestsAccumulator::new);
        assertSameForEveryOrder(FlakinessScoreAccumulator::new);
        assertSameForEveryOrder(FailureHeatmapAccumulator::new);
        assertSameForEveryOrder(SuiteDurationAccumulator::new);
        assertSameForEveryOrder(PassRateAccumulator::new);
    }

    @Test
    void latestRunKpis_AreOrderIndependent() {
        assertSameForEveryOrder(() -> new TestComplexityAccumulator(List.of(5, 10, 20, 50)));
        assertSameForEveryOrder(() -> new AssertionDensityAccumulator(resolver, List.of("should", "verify"), 20));
    }

    private static void assertSameForEveryOrder(Supplier<KpiAccumulator<?>> factory) {
        Object expected = fold(factory.get(), reports);
        Random random = new Random(42);
        for (int i = 0; i < 10; i++) {
            List<ReportData> shuffled = new ArrayList<>(reports);
            Collections.shuffle(shuffled, random);
            assertEquals(expected, fold(factory.get(), shuffled));
        }
    }

    private static Object fold(KpiAccumulator<?> accumulator, List<ReportData> order) {
        order.forEach(accumulator::fold);
        return accumulator.finish();
    }
}
