package com.testinsight.analyzer;

import com.testinsight.model.TestResult;
import com.testinsight.model.enums.TestStatus;

import java.time.LocalDate;
import java.util.*;

/**
 * Day-by-day status grid for the most failing tests. A day with any failure shows FAIL.
 */
public class FailureHeatmapAccumulator implements KpiAccumulator<FailureHeatmapAccumulator.Result> {

    private static final int LISTED_TESTS = 20;
    private static final String NO_RESULT = "NONE";

    public record Cell(LocalDate date, String status) {}

    public record TestRow(String testName, List<Cell> cells) {}

    public record Result(List<LocalDate> dates, List<TestRow> tests) {}

    private final Map<String, Map<LocalDate, TestStatus>> cells = new HashMap<>();
    private final Map<String, Long> failures = new HashMap<>();
    private final SortedSet<LocalDate> dates = new TreeSet<>();

    @Override
    public void fold(ReportData report) {
        LocalDate day = report.run().getFinishedAt().toLocalDate();
        dates.add(day);
        for (TestResult test : report.tests()) {
            cells.computeIfAbsent(test.getTestName(), k -> new HashMap<>())
                    .merge(day, test.getStatus(), FailureHeatmapAccumulator::dominant);
            if (test.getStatus() == TestStatus.FAIL) {
                failures.merge(test.getTestName(), 1L, Long::sum);
            }
        }
    }

    @Override
    public Result finish() {
        List<TestRow> rows = failures.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(LISTED_TESTS)
                .map(e -> {
                    Map<LocalDate, TestStatus> byDay = cells.getOrDefault(e.getKey(), Map.of());
                    List<Cell> row = dates.stream()
                            .map(d -> new Cell(d, byDay.containsKey(d) ? byDay.get(d).name() : NO_RESULT))
                            .toList();
                    return new TestRow(e.getKey(), row);
                })
                .toList();
        return new Result(List.copyOf(dates), rows);
    }

    // FAIL over PASS over SKIP
    private static TestStatus dominant(TestStatus a, TestStatus b) {
        if (a == TestStatus.FAIL || b == TestStatus.FAIL) return TestStatus.FAIL;
        if (a == TestStatus.PASS || b == TestStatus.PASS) return TestStatus.PASS;
        return a;
    }
}
