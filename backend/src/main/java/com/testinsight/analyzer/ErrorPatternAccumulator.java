package com.testinsight.analyzer;

import com.testinsight.model.TestResult;
import com.testinsight.model.enums.TestStatus;

import java.util.*;

/**
 * Clusters failure messages that differ only in embedded literals.
 */
public class ErrorPatternAccumulator implements KpiAccumulator<ErrorPatternAccumulator.Result> {

    public record ErrorPattern(String pattern, long count, List<String> exampleTests) {}

    public record Result(long totalErrors, int uniquePatterns, List<ErrorPattern> patterns) {}

    private final ErrorPatternNormalizer normalizer;
    private final int maxPatterns;
    private final int maxExamples;
    private final Map<String, Long> counts = new HashMap<>();
    // Alphabetically first test names, so the sample is independent of fold order.
    private final Map<String, TreeSet<String>> examples = new HashMap<>();

    public ErrorPatternAccumulator(ErrorPatternNormalizer normalizer, int maxPatterns, int maxExamples) {
        this.normalizer = normalizer;
        this.maxPatterns = maxPatterns;
        this.maxExamples = maxExamples;
    }

    @Override
    public void fold(ReportData report) {
        for (TestResult test : report.tests()) {
            if (test.getStatus() != TestStatus.FAIL) continue;
            String message = test.getErrorMessage();
            if (message == null || message.isBlank()) continue;

            String key = normalizer.normalize(message);
            counts.merge(key, 1L, Long::sum);
            TreeSet<String> sample = examples.computeIfAbsent(key, k -> new TreeSet<>());
            sample.add(test.getTestName());
            if (sample.size() > maxExamples) {
                sample.pollLast();
            }
        }
    }

    @Override
    public Result finish() {
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        List<ErrorPattern> patterns = counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(maxPatterns)
                .map(e -> new ErrorPattern(e.getKey(), e.getValue(), List.copyOf(examples.get(e.getKey()))))
                .toList();
        return new Result(total, counts.size(), patterns);
    }
}
