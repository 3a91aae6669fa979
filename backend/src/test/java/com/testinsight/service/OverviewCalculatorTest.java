package com.testinsight.service;

import com.testinsight.dto.TrendPoint;
import com.testinsight.model.RunRecord;
import com.testinsight.model.enums.RunStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class OverviewCalculatorTest {

    private static final LocalDate FIRST = LocalDate.of(2024, 3, 1);
    private static final LocalDate LAST = LocalDate.of(2024, 3, 3);

    private final OverviewCalculator calculator = new OverviewCalculator();
    private final UUID repoA = UUID.randomUUID();
    private final UUID repoB = UUID.randomUUID();

    @Test
    void calculate_NoRuns_ZeroCountersAndZeroRate() {
        OverviewCalculator.Result result = calculator.calculate(List.of(), 0, FIRST, LAST);

        assertEquals(0, result.totalRuns());
        assertEquals(0.0, result.successRate());
        assertFalse(Double.isNaN(result.avgDurationSeconds()));
        assertEquals(3, result.trend().size());
        assertTrue(result.trend().stream().allMatch(p -> p.getTotal() == 0));
        assertEquals(0.0, result.successRates().get(0).getSuccessRate());
    }

    @Test
    void calculate_CountsRunsAndDailySeries() {
        List<RunRecord> runs = List.of(
                run(repoA, FIRST.atTime(9, 0), 60, RunStatus.PASSED),
                run(repoA, FIRST.atTime(10, 0), 120, RunStatus.FAILED),
                run(repoB, LAST.atTime(8, 0), 30, RunStatus.ERROR),
                run(repoB, LAST.atTime(9, 0), 30, RunStatus.PASSED));

        OverviewCalculator.Result result = calculator.calculate(runs, 42, FIRST, LAST);

        assertEquals(4, result.totalRuns());
        assertEquals(2, result.passedRuns());
        assertEquals(1, result.failedRuns());
        assertEquals(50.0, result.successRate());
        assertEquals(60.0, result.avgDurationSeconds());
        assertEquals(42, result.totalTests());
        assertEquals(2, result.activeRepos());

        TrendPoint first = result.trend().get(0);
        assertEquals(FIRST, first.getDate());
        assertEquals(1, first.getPassed());
        assertEquals(1, first.getFailed());
        assertEquals(2, first.getTotal());
        assertEquals(90.0, first.getAvgDuration());
        assertEquals(0, result.trend().get(1).getTotal());
        assertEquals(1, result.trend().get(2).getError());
        assertEquals(50.0, result.successRates().get(2).getSuccessRate());
    }

    @Test
    void calculate_SuccessRateStaysWithinBounds() {
        List<RunRecord> runs = List.of(
                run(repoA, FIRST.atTime(9, 0), 1, RunStatus.PASSED),
                run(repoA, FIRST.atTime(9, 5), 1, RunStatus.PASSED),
                run(repoA, FIRST.atTime(9, 10), 1, RunStatus.CANCELLED));

        double rate = calculator.calculate(runs, 0, FIRST, LAST).successRate();

        assertEquals(66.7, rate);
        assertTrue(rate >= 0 && rate <= 100);
    }

    private static RunRecord run(UUID repo, LocalDateTime finishedAt, int seconds, RunStatus status) {
        return RunRecord.builder()
                .id(UUID.randomUUID())
                .repositoryId(repo)
                .startedAt(finishedAt.minusSeconds(seconds))
                .finishedAt(finishedAt)
                .status(status)
                .build();
    }
}
