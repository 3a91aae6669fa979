package com.testinsight.analyzer;

import com.testinsight.model.TestResult;

import java.util.*;

public class SlowestTestsAccumulator implements KpiAccumulator<SlowestTestsAccumulator.Result> {

    private static final int LISTED_TESTS = 20;

    public record TestDuration(String testName, String suiteName, double avgDuration, double minDuration,
                               double maxDuration, long runCount) {}

    public record Result(int totalTests, List<TestDuration> tests) {}

    private static final class Stats {
        long totalMicros;
        long minMicros = Long.MAX_VALUE;
        long maxMicros = Long.MIN_VALUE;
        long count;
    }

    private final Map<TestKey, Stats> stats = new HashMap<>();

    @Override
    public void fold(ReportData report) {
        for (TestResult test : report.tests()) {
            long micros = Rounding.toMicros(test.getDurationSeconds());
            Stats s = stats.computeIfAbsent(TestKey.of(test), k -> new Stats());
            s.totalMicros += micros;
            s.minMicros = Math.min(s.minMicros, micros);
            s.maxMicros = Math.max(s.maxMicros, micros);
            s.count++;
        }
    }

    @Override
    public Result finish() {
        List<TestDuration> tests = stats.entrySet().stream()
                .map(e -> {
                    Stats s = e.getValue();
                    double avg = Rounding.toSeconds(s.totalMicros) / s.count;
                    return new TestDuration(e.getKey().testName(), e.getKey().suiteName(),
                            Rounding.round(avg, 2),
                            Rounding.round(Rounding.toSeconds(s.minMicros), 2),
                            Rounding.round(Rounding.toSeconds(s.maxMicros), 2),
                            s.count);
                })
                .sorted(Comparator.comparingDouble(TestDuration::avgDuration).reversed()
                        .thenComparing(TestDuration::testName)
                        .thenComparing(TestDuration::suiteName))
                .limit(LISTED_TESTS)
                .toList();
        return new Result(stats.size(), tests);
    }
}
