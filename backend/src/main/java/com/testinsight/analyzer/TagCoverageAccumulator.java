package com.testinsight.analyzer;

import com.testinsight.model.TestResult;

import java.util.*;

public class TagCoverageAccumulator implements KpiAccumulator<TagCoverageAccumulator.Result> {

    public record TagCount(String tag, long count) {}

    public record Result(long totalTests, int distinctTags, long untaggedCount, double avgTagsPerTest,
                         List<TagCount> tags) {}

    private final int limit;
    private final Map<String, Long> tagCounts = new HashMap<>();
    private long totalTests;
    private long untagged;
    private long totalTags;

    public TagCoverageAccumulator(int limit) {
        this.limit = limit;
    }

    @Override
    public void fold(ReportData report) {
        for (TestResult test : report.tests()) {
            totalTests++;
            Set<String> tags = new TreeSet<>();
            if (test.getTags() != null) {
                test.getTags().stream()
                        .filter(t -> t != null && !t.isBlank())
                        .map(String::trim)
                        .forEach(tags::add);
            }
            if (tags.isEmpty()) untagged++;
            totalTags += tags.size();
            tags.forEach(tag -> tagCounts.merge(tag, 1L, Long::sum));
        }
    }

    @Override
    public Result finish() {
        double avg = totalTests == 0 ? 0.0 : Rounding.round((double) totalTags / totalTests, 1);
        List<TagCount> tags = tagCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .map(e -> new TagCount(e.getKey(), e.getValue()))
                .toList();
        return new Result(totalTests, tagCounts.size(), untagged, avg, tags);
    }
}
