package com.testinsight.analyzer;

import com.testinsight.model.KeywordCall;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class LibraryDistributionAccumulator implements KpiAccumulator<LibraryDistributionAccumulator.Result> {

    public record LibraryShare(String library, long count, double percentage, double totalDuration) {}

    public record Result(long totalCalls, List<LibraryShare> libraries) {}

    private final KeywordLibraryResolver resolver;
    private final Map<String, Long> counts = new HashMap<>();
    private final Map<String, Long> micros = new HashMap<>();

    public LibraryDistributionAccumulator(KeywordLibraryResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public void fold(ReportData report) {
        for (KeywordCall call : report.keywords()) {
            String library = resolver.libraryOf(call);
            counts.merge(library, 1L, Long::sum);
            micros.merge(library, Rounding.toMicros(call.getDurationSeconds()), Long::sum);
        }
    }

    @Override
    public Result finish() {
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        List<LibraryShare> libraries = counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .map(e -> new LibraryShare(e.getKey(), e.getValue(), Rounding.percentage(e.getValue(), total),
                        Rounding.round(Rounding.toSeconds(micros.get(e.getKey())), 2)))
                .toList();
        return new Result(total, libraries);
    }
}
