package com.testinsight.analyzer;

import com.testinsight.model.KeywordCall;
import com.testinsight.model.TestResult;

import java.util.*;

/**
 * Finds contiguous top-level keyword sequences shared by more than one distinct test.
 *
 * <p>Only lengths between {@code minLength} and {@code maxLength} are enumerated. A sequence is
 * counted once per test however often the test repeats it.
 */
public class RedundancyAccumulator implements KpiAccumulator<RedundancyAccumulator.Result> {

    public record SharedSequence(List<String> keywords, int length, int occurrenceCount, List<String> tests) {}

    public record Result(int totalSharedSequences, List<SharedSequence> sequences) {}

    private static final Comparator<Map.Entry<List<String>, Set<TestKey>>> RANKING =
            Comparator.<Map.Entry<List<String>, Set<TestKey>>>comparingInt(e -> e.getValue().size()).reversed()
                    .thenComparing(e -> e.getKey().size(), Comparator.reverseOrder())
                    .thenComparing(e -> String.join("\u0000", e.getKey()));

    private final int minLength;
    private final int maxLength;
    private final int maxResults;
    private final int maxTestsListed;
    private final Map<List<String>, Set<TestKey>> testsBySequence = new HashMap<>();

    public RedundancyAccumulator(int minLength, int maxLength, int maxResults, int maxTestsListed) {
        if (minLength < 2) {
            throw new IllegalArgumentException("Minimum sequence length must be at least 2");
        }
        this.minLength = minLength;
        this.maxLength = Math.max(minLength, maxLength);
        this.maxResults = maxResults;
        this.maxTestsListed = maxTestsListed;
    }

    @Override
    public void fold(ReportData report) {
        Map<TestKey, List<KeywordCall>> byTest = report.keywordsByTest();
        for (TestResult test : report.tests()) {
            TestKey key = TestKey.of(test);
            List<String> names = ReportData.topLevelNames(byTest.get(key));
            for (int length = minLength; length <= maxLength && length <= names.size(); length++) {
                for (int start = 0; start + length <= names.size(); start++) {
                    List<String> sequence = List.copyOf(names.subList(start, start + length));
                    testsBySequence.computeIfAbsent(sequence, k -> new HashSet<>()).add(key);
                }
            }
        }
    }

    @Override
    public Result finish() {
        List<Map.Entry<List<String>, Set<TestKey>>> shared = testsBySequence.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .sorted(RANKING)
                .toList();

        List<SharedSequence> sequences = shared.stream()
                .limit(maxResults)
                .map(e -> new SharedSequence(
                        e.getKey(),
                        e.getKey().size(),
                        e.getValue().size(),
                        e.getValue().stream().sorted().map(TestKey::testName).limit(maxTestsListed).toList()))
                .toList();
        return new Result(shared.size(), sequences);
    }
}
