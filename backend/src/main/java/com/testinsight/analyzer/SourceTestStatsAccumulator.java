package com.testinsight.analyzer;

import com.testinsight.source.SourceBrowser;
import com.testinsight.source.SourceTestCase;
import com.testinsight.source.SourceTestFile;

import java.util.*;

/**
 * Static test statistics of the repository's suite sources. Run reports are not consulted.
 */
public class SourceTestStatsAccumulator implements KpiAccumulator<SourceTestStatsAccumulator.Result> {

    private static final int LISTED_FILES = 30;

    public record KeywordUsage(String name, long count, double percentage, String library) {}

    public record FileSummary(String path, int testCount, int totalSteps, double avgSteps, double avgLines) {}

    public record Result(int totalFiles, int totalTests,
                         double avgLines, int minLines, int maxLines,
                         double avgSteps, int minSteps, int maxSteps,
                         List<StepHistogram.Bucket> stepHistogram,
                         List<KeywordUsage> topKeywords,
                         List<FileSummary> files) {}

    private final SourceBrowser sourceBrowser;
    private final UUID repositoryId;
    private final KeywordLibraryResolver resolver;
    private final List<Integer> bucketBounds;
    private final int keywordLimit;

    public SourceTestStatsAccumulator(SourceBrowser sourceBrowser, UUID repositoryId, KeywordLibraryResolver resolver,
                                      List<Integer> bucketBounds, int keywordLimit) {
        this.sourceBrowser = sourceBrowser;
        this.repositoryId = repositoryId;
        this.resolver = resolver;
        this.bucketBounds = bucketBounds;
        this.keywordLimit = keywordLimit;
    }

    @Override
    public void fold(ReportData report) {
        // source-based: nothing to fold
    }

    @Override
    public Result finish() {
        List<SourceTestFile> files = repositoryId != null ? sourceBrowser.listTestFiles(repositoryId) : List.of();
        List<SourceTestCase> tests = files.stream().flatMap(f -> f.tests().stream()).toList();
        if (tests.isEmpty()) {
            return new Result(0, 0, 0.0, 0, 0, 0.0, 0, 0,
                    StepHistogram.of(List.of(), bucketBounds), List.of(), List.of());
        }

        IntSummaryStatistics lines = tests.stream().mapToInt(SourceTestCase::lineCount).summaryStatistics();
        List<Integer> stepCounts = tests.stream().map(t -> t.steps().size()).toList();
        IntSummaryStatistics steps = stepCounts.stream().mapToInt(Integer::intValue).summaryStatistics();

        Map<String, Long> keywordCounts = new HashMap<>();
        tests.forEach(t -> t.steps().forEach(step -> keywordCounts.merge(step, 1L, Long::sum)));
        long totalSteps = keywordCounts.values().stream().mapToLong(Long::longValue).sum();
        List<KeywordUsage> topKeywords = keywordCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(keywordLimit)
                .map(e -> new KeywordUsage(e.getKey(), e.getValue(), Rounding.percentage(e.getValue(), totalSteps),
                        resolver.resolveLibrary(e.getKey())))
                .toList();

        List<FileSummary> summaries = files.stream()
                .map(SourceTestStatsAccumulator::summarize)
                .sorted(Comparator.comparingInt(FileSummary::testCount).reversed()
                        .thenComparing(FileSummary::path))
                .limit(LISTED_FILES)
                .toList();

        return new Result(files.size(), tests.size(),
                Rounding.round(lines.getAverage(), 1), lines.getMin(), lines.getMax(),
                Rounding.round(steps.getAverage(), 1), steps.getMin(), steps.getMax(),
                StepHistogram.of(stepCounts, bucketBounds), topKeywords, summaries);
    }

    private static FileSummary summarize(SourceTestFile file) {
        int count = file.tests().size();
        int totalSteps = file.tests().stream().mapToInt(t -> t.steps().size()).sum();
        int totalLines = file.tests().stream().mapToInt(SourceTestCase::lineCount).sum();
        return new FileSummary(file.path(), count, totalSteps,
                Rounding.round((double) totalSteps / count, 1), Rounding.round((double) totalLines / count, 1));
    }
}
