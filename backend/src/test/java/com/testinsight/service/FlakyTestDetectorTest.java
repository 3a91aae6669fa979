package com.testinsight.service;

import com.testinsight.model.FlakyTestEntry;
import com.testinsight.model.RunRecord;
import com.testinsight.model.TestResult;
import com.testinsight.model.enums.RunStatus;
import com.testinsight.model.enums.TestStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.testinsight.model.enums.TestStatus.*;
import static org.junit.jupiter.api.Assertions.*;

class FlakyTestDetectorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 10, 12, 0);
    private static final AggregationKey KEY = new AggregationKey(30, null);

    private final FlakyTestDetector detector = new FlakyTestDetector();
    private final List<RunRecord> runs = new ArrayList<>();
    private final List<TestResult> results = new ArrayList<>();

    @Test
    void detect_AlwaysPassing_IsExcluded() {
        history("Stable", PASS, PASS, PASS);

        assertTrue(detect().isEmpty());
    }

    @Test
    void detect_PassFailPass_HasTwoFlips() {
        history("Flaky", PASS, FAIL, PASS);

        FlakyTestEntry entry = detect().get(0);

        assertEquals(2, entry.getFlipCount());
        assertEquals(3, entry.getTotalRuns());
        assertEquals(2, entry.getPassCount());
        assertEquals(1, entry.getFailCount());
        assertEquals(66.7, entry.getFlakyRate());
        assertEquals(PASS, entry.getLastStatus());
        assertEquals(1, entry.getRank());
        assertEquals("all", entry.getScopeKey());
    }

    @Test
    void detect_FailFailPassFail_HasTwoFlips() {
        history("Flaky", FAIL, FAIL, PASS, FAIL);

        FlakyTestEntry entry = detect().get(0);

        assertEquals(2, entry.getFlipCount());
        assertEquals(FAIL, entry.getLastStatus());
    }

    @Test
    void detect_OrdersByFinishTimeNotInputOrder() {
        history("Flaky", PASS, FAIL, PASS);
        java.util.Collections.reverse(results);

        assertEquals(2, detect().get(0).getFlipCount());
    }

    @Test
    void detect_RanksByFlipsThenLowestRate() {
        history("OneFlip", PASS, PASS, FAIL);
        history("Unstable", PASS, FAIL, PASS, FAIL);
        history("MostlyFailing", FAIL, FAIL, PASS);
        history("MostlyPassing", PASS, PASS, FAIL);

        List<String> ranked = detect().stream().map(FlakyTestEntry::getTestName).toList();

        assertEquals(List.of("Unstable", "MostlyFailing", "MostlyPassing", "OneFlip"), ranked);
    }

    @Test
    void detect_IgnoresSkippedResults() {
        history("Skippy", PASS, SKIP, PASS);

        assertTrue(detect().isEmpty());
    }

    private List<FlakyTestEntry> detect() {
        return detector.detect(runs, results, KEY, NOW);
    }

    // Each status goes into its own run, one hour after the previous.
    private void history(String testName, TestStatus... statuses) {
        for (int i = 0; i < statuses.length; i++) {
            RunRecord run = RunRecord.builder()
                    .id(UUID.randomUUID())
                    .repositoryId(UUID.randomUUID())
                    .startedAt(NOW.minusDays(5).plusHours(i))
                    .finishedAt(NOW.minusDays(5).plusHours(i).plusMinutes(1))
                    .status(RunStatus.PASSED)
                    .build();
            runs.add(run);
            results.add(TestResult.builder()
                    .runId(run.getId())
                    .testName(testName)
                    .suiteName("Suite")
                    .status(statuses[i])
                    .build());
        }
    }
}
