package com.testinsight.analyzer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.testinsight.model.enums.TestStatus.*;
import static org.junit.jupiter.api.Assertions.*;

class ExecutionKpiAccumulatorTest {

    @Test
    void passRate_WorstTestFirst() {
        PassRateAccumulator accumulator = new PassRateAccumulator();
        accumulator.fold(Reports.run(0).test("Stable", PASS).test("Broken", FAIL).test("Skipped", SKIP).build());
        accumulator.fold(Reports.run(1).test("Stable", PASS).test("Broken", PASS).build());

        PassRateAccumulator.Result result = accumulator.finish();

        assertEquals(3, result.totalTests());
        assertEquals("Skipped", result.tests().get(0).testName());
        PassRateAccumulator.TestPassRate broken = result.tests().get(1);
        assertEquals("Broken", broken.testName());
        assertEquals(50.0, broken.passRate());
        assertEquals(2, broken.totalCount());
        assertEquals(100.0, result.tests().get(2).passRate());
    }

    @Test
    void slowestTests_AveragesAndBounds() {
        SlowestTestsAccumulator accumulator = new SlowestTestsAccumulator();
        accumulator.fold(Reports.run(0)
                .test("Slow", "S", PASS, 10.0, null, List.of())
                .test("Fast", "S", PASS, 0.5, null, List.of())
                .build());
        accumulator.fold(Reports.run(1).test("Slow", "S", PASS, 20.0, null, List.of()).build());

        SlowestTestsAccumulator.TestDuration slow = accumulator.finish().tests().get(0);

        assertEquals("Slow", slow.testName());
        assertEquals(15.0, slow.avgDuration());
        assertEquals(10.0, slow.minDuration());
        assertEquals(20.0, slow.maxDuration());
        assertEquals(2, slow.runCount());
    }

    @Test
    void flakinessScore_TransitionsPerRun() {
        FlakinessScoreAccumulator accumulator = new FlakinessScoreAccumulator();
        accumulator.fold(Reports.run(0).test("Flaky", PASS).test("Stable", PASS).test("Once", FAIL).build());
        accumulator.fold(Reports.run(1).test("Flaky", FAIL).test("Stable", PASS).build());
        accumulator.fold(Reports.run(2).test("Flaky", PASS).test("Stable", PASS).build());

        FlakinessScoreAccumulator.Result result = accumulator.finish();

        assertEquals(2, result.totalTests());
        assertEquals(1, result.tests().size());
        FlakinessScoreAccumulator.TestFlakiness flaky = result.tests().get(0);
        assertEquals(2, flaky.transitions());
        assertEquals(1.0, flaky.flakinessScore());
        assertEquals(List.of("PASS", "FAIL", "PASS"), flaky.timeline());
    }

    @Test
    void failureHeatmap_FailDominatesAndMissingDaysAreNone() {
        FailureHeatmapAccumulator accumulator = new FailureHeatmapAccumulator();
        accumulator.fold(Reports.run(Reports.BASE).test("T", FAIL).test("Never Fails", PASS).build());
        accumulator.fold(Reports.run(Reports.BASE.plusHours(2)).test("T", PASS).build());
        accumulator.fold(Reports.run(Reports.BASE.plusDays(1)).test("Other", FAIL).build());

        FailureHeatmapAccumulator.Result result = accumulator.finish();

        assertEquals(2, result.dates().size());
        assertEquals(2, result.tests().size());
        FailureHeatmapAccumulator.TestRow other = result.tests().get(0);
        assertEquals("Other", other.testName());
        assertEquals("NONE", other.cells().get(0).status());
        assertEquals("FAIL", other.cells().get(1).status());
        FailureHeatmapAccumulator.TestRow t = result.tests().get(1);
        assertEquals("FAIL", t.cells().get(0).status());
        assertEquals("NONE", t.cells().get(1).status());
    }

    @Test
    void suiteDuration_SharesOfTotal() {
        SuiteDurationAccumulator accumulator = new SuiteDurationAccumulator();
        accumulator.fold(Reports.run(0)
                .test("A", "Big", PASS, 3.0, null, List.of())
                .test("B", "Big", PASS, 3.0, null, List.of())
                .test("C", "Small", PASS, 2.0, null, List.of())
                .build());

        SuiteDurationAccumulator.Result result = accumulator.finish();

        assertEquals(8.0, result.totalDuration());
        assertEquals("Big", result.suites().get(0).suiteName());
        assertEquals(75.0, result.suites().get(0).percentage());
        assertEquals(2, result.suites().get(0).testCount());
        assertEquals(25.0, result.suites().get(1).percentage());
    }

    @Test
    void statusTransitions_CountsAdjacentChanges() {
        assertEquals(0, StatusTransitions.countFlips(List.of(PASS, PASS, PASS)));
        assertEquals(2, StatusTransitions.countFlips(List.of(PASS, FAIL, PASS)));
        assertEquals(2, StatusTransitions.countFlips(List.of(FAIL, FAIL, PASS, FAIL)));
        assertEquals(1, StatusTransitions.countFlips(List.of(PASS, SKIP, FAIL)));
    }
}
