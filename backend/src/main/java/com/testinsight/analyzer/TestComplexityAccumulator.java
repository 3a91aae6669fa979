package com.testinsight.analyzer;

import com.testinsight.model.KeywordCall;
import com.testinsight.model.TestResult;

import java.util.*;

/**
 * Top-level step count per distinct test, taken from the test's most recent run in scope.
 */
public class TestComplexityAccumulator implements KpiAccumulator<TestComplexityAccumulator.Result> {

    private static final int LISTED_TESTS = 30;

    public record TestSteps(String name, String suite, int steps) {}

    public record Result(int totalTests, double avg, int min, int max,
                         List<StepHistogram.Bucket> histogram, List<TestSteps> tests) {}

    private final List<Integer> bucketBounds;
    private final LatestPerTest<Integer> steps = new LatestPerTest<>();

    public TestComplexityAccumulator(List<Integer> bucketBounds) {
        this.bucketBounds = bucketBounds;
    }

    @Override
    public void fold(ReportData report) {
        Map<TestKey, List<KeywordCall>> byTest = report.keywordsByTest();
        for (TestResult test : report.tests()) {
            int count = ReportData.topLevelNames(byTest.get(TestKey.of(test))).size();
            steps.offer(TestKey.of(test), report.run(), count);
        }
    }

    @Override
    public Result finish() {
        Map<TestKey, Integer> values = steps.values();
        if (values.isEmpty()) {
            return new Result(0, 0.0, 0, 0, StepHistogram.of(List.of(), bucketBounds), List.of());
        }
        IntSummaryStatistics stats = values.values().stream().mapToInt(Integer::intValue).summaryStatistics();
        List<TestSteps> tests = values.entrySet().stream()
                .map(e -> new TestSteps(e.getKey().testName(), e.getKey().suiteName(), e.getValue()))
                .sorted(Comparator.comparingInt(TestSteps::steps).reversed()
                        .thenComparing(TestSteps::name)
                        .thenComparing(TestSteps::suite))
                .limit(LISTED_TESTS)
                .toList();
        return new Result(values.size(), Rounding.round(stats.getAverage(), 1), stats.getMin(), stats.getMax(),
                StepHistogram.of(values.values(), bucketBounds), tests);
    }
}
