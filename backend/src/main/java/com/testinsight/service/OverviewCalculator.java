package com.testinsight.service;

import com.testinsight.analyzer.Rounding;
import com.testinsight.dto.SuccessRatePoint;
import com.testinsight.dto.TrendPoint;
import com.testinsight.model.RunRecord;
import com.testinsight.model.enums.RunStatus;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.*;

/**
 * Overview counters and daily series over a set of finished runs.
 */
@Component
public class OverviewCalculator {

    public record Result(long totalRuns, long passedRuns, long failedRuns, double successRate,
                         double avgDurationSeconds, long totalTests, long activeRepos,
                         List<TrendPoint> trend, List<SuccessRatePoint> successRates) {}

    /**
     * @param runs       finished runs inside the window
     * @param totalTests number of test results belonging to {@code runs}
     * @param firstDay   first calendar day of the series
     * @param lastDay    last calendar day of the series, inclusive
     */
    public Result calculate(List<RunRecord> runs, long totalTests, LocalDate firstDay, LocalDate lastDay) {
        long passed = count(runs, RunStatus.PASSED);
        long failed = count(runs, RunStatus.FAILED);
        long activeRepos = runs.stream().map(RunRecord::getRepositoryId).distinct().count();

        Map<LocalDate, List<RunRecord>> byDay = new TreeMap<>();
        for (RunRecord run : runs) {
            byDay.computeIfAbsent(run.getFinishedAt().toLocalDate(), d -> new ArrayList<>()).add(run);
        }

        List<TrendPoint> trend = new ArrayList<>();
        List<SuccessRatePoint> successRates = new ArrayList<>();
        for (LocalDate day = firstDay; !day.isAfter(lastDay); day = day.plusDays(1)) {
            List<RunRecord> dayRuns = byDay.getOrDefault(day, List.of());
            long dayPassed = count(dayRuns, RunStatus.PASSED);
            trend.add(TrendPoint.builder()
                    .date(day)
                    .passed(dayPassed)
                    .failed(count(dayRuns, RunStatus.FAILED))
                    .error(count(dayRuns, RunStatus.ERROR))
                    .total(dayRuns.size())
                    .avgDuration(Rounding.round(avgSeconds(dayRuns), 2))
                    .build());
            successRates.add(SuccessRatePoint.builder()
                    .date(day)
                    .successRate(Rounding.percentage(dayPassed, dayRuns.size()))
                    .totalRuns(dayRuns.size())
                    .build());
        }

        return new Result(runs.size(), passed, failed, Rounding.percentage(passed, runs.size()),
                Rounding.round(avgSeconds(runs), 1), totalTests, activeRepos, trend, successRates);
    }

    private static long count(List<RunRecord> runs, RunStatus status) {
        return runs.stream().filter(r -> r.getStatus() == status).count();
    }

    // Millisecond sums keep the average independent of run order.
    private static double avgSeconds(List<RunRecord> runs) {
        long millis = 0;
        int completed = 0;
        for (RunRecord run : runs) {
            if (run.getStartedAt() == null || run.getFinishedAt() == null) continue;
            millis += Math.max(0, Duration.between(run.getStartedAt(), run.getFinishedAt()).toMillis());
            completed++;
        }
        return completed == 0 ? 0.0 : millis / 1000.0 / completed;
    }
}
