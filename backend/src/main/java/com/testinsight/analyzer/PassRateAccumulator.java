package com.testinsight.analyzer;

import com.testinsight.model.TestResult;

import java.util.*;

public class PassRateAccumulator implements KpiAccumulator<PassRateAccumulator.Result> {

    private static final int LISTED_TESTS = 50;

    public record TestPassRate(String testName, String suiteName, long passCount, long failCount, long skipCount,
                               long totalCount, double passRate) {}

    public record Result(int totalTests, List<TestPassRate> tests) {}

    private final Map<TestKey, long[]> counts = new HashMap<>();

    @Override
    public void fold(ReportData report) {
        for (TestResult test : report.tests()) {
            long[] c = counts.computeIfAbsent(TestKey.of(test), k -> new long[3]);
            switch (test.getStatus()) {
                case PASS -> c[0]++;
                case FAIL -> c[1]++;
                case SKIP -> c[2]++;
            }
        }
    }

    @Override
    public Result finish() {
        List<TestPassRate> tests = counts.entrySet().stream()
                .map(e -> {
                    long[] c = e.getValue();
                    long total = c[0] + c[1] + c[2];
                    return new TestPassRate(e.getKey().testName(), e.getKey().suiteName(), c[0], c[1], c[2], total,
                            Rounding.percentage(c[0], total));
                })
                .sorted(Comparator.comparingDouble(TestPassRate::passRate)
                        .thenComparing(TestPassRate::totalCount, Comparator.reverseOrder())
                        .thenComparing(TestPassRate::testName)
                        .thenComparing(TestPassRate::suiteName))
                .limit(LISTED_TESTS)
                .toList();
        return new Result(counts.size(), tests);
    }
}
