package com.testinsight.analyzer;

import com.testinsight.model.KeywordCall;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Call counts per keyword across every call depth.
 */
public class KeywordFrequencyAccumulator implements KpiAccumulator<KeywordFrequencyAccumulator.Result> {

    public record KeywordCount(String name, String library, long count, double percentage) {}

    public record Result(long totalCalls, int uniqueKeywords, List<KeywordCount> topKeywords) {}

    private final KeywordLibraryResolver resolver;
    private final int limit;
    private final Map<String, Long> counts = new HashMap<>();
    private final Map<String, String> libraries = new HashMap<>();

    public KeywordFrequencyAccumulator(KeywordLibraryResolver resolver, int limit) {
        this.resolver = resolver;
        this.limit = limit;
    }

    @Override
    public void fold(ReportData report) {
        for (KeywordCall call : report.keywords()) {
            String name = resolver.canonicalName(call.getKeywordName());
            counts.merge(name, 1L, Long::sum);
            libraries.merge(name, resolver.libraryOf(call), LibraryLabels::prefer);
        }
    }

    @Override
    public Result finish() {
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        List<KeywordCount> top = counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .map(e -> new KeywordCount(e.getKey(), libraries.get(e.getKey()), e.getValue(),
                        Rounding.percentage(e.getValue(), total)))
                .toList();
        return new Result(total, counts.size(), top);
    }
}
