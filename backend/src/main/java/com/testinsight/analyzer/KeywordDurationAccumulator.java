package com.testinsight.analyzer;

import com.testinsight.model.KeywordCall;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Keywords ranked by the cumulative time they consumed.
 */
public class KeywordDurationAccumulator implements KpiAccumulator<KeywordDurationAccumulator.Result> {

    public record KeywordDuration(String name, String library, double totalDuration, double avgDuration, long calls) {}

    public record Result(List<KeywordDuration> topByDuration) {}

    private final KeywordLibraryResolver resolver;
    private final int limit;
    private final Map<String, Long> micros = new HashMap<>();
    private final Map<String, Long> calls = new HashMap<>();
    private final Map<String, String> libraries = new HashMap<>();

    public KeywordDurationAccumulator(KeywordLibraryResolver resolver, int limit) {
        this.resolver = resolver;
        this.limit = limit;
    }

    @Override
    public void fold(ReportData report) {
        for (KeywordCall call : report.keywords()) {
            String name = resolver.canonicalName(call.getKeywordName());
            micros.merge(name, Rounding.toMicros(call.getDurationSeconds()), Long::sum);
            calls.merge(name, 1L, Long::sum);
            libraries.merge(name, resolver.libraryOf(call), LibraryLabels::prefer);
        }
    }

    @Override
    public Result finish() {
        List<KeywordDuration> top = micros.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .map(e -> {
                    long count = calls.get(e.getKey());
                    double total = Rounding.toSeconds(e.getValue());
                    return new KeywordDuration(e.getKey(), libraries.get(e.getKey()),
                            Rounding.round(total, 2), Rounding.round(total / count, 2), count);
                })
                .toList();
        return new Result(top);
    }
}
