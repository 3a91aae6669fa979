package com.testinsight.analyzer;

import com.testinsight.model.TestResult;

import java.util.*;

public class SuiteDurationAccumulator implements KpiAccumulator<SuiteDurationAccumulator.Result> {

    private static final int LISTED_SUITES = 30;
    private static final String UNNAMED_SUITE = "Unknown";

    public record SuiteDuration(String suiteName, double totalDuration, long testCount, double percentage) {}

    public record Result(double totalDuration, List<SuiteDuration> suites) {}

    private final Map<String, Long> micros = new HashMap<>();
    private final Map<String, Long> testCounts = new HashMap<>();

    @Override
    public void fold(ReportData report) {
        for (TestResult test : report.tests()) {
            String suite = test.getSuiteName() == null || test.getSuiteName().isBlank()
                    ? UNNAMED_SUITE : test.getSuiteName();
            micros.merge(suite, Rounding.toMicros(test.getDurationSeconds()), Long::sum);
            testCounts.merge(suite, 1L, Long::sum);
        }
    }

    @Override
    public Result finish() {
        long totalMicros = micros.values().stream().mapToLong(Long::longValue).sum();
        List<SuiteDuration> suites = micros.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(LISTED_SUITES)
                .map(e -> new SuiteDuration(e.getKey(),
                        Rounding.round(Rounding.toSeconds(e.getValue()), 2),
                        testCounts.get(e.getKey()),
                        Rounding.percentage(e.getValue(), totalMicros)))
                .toList();
        return new Result(Rounding.round(Rounding.toSeconds(totalMicros), 2), suites);
    }
}
