package com.testinsight.service;

import com.testinsight.analyzer.Rounding;
import com.testinsight.analyzer.StatusTransitions;
import com.testinsight.analyzer.TestKey;
import com.testinsight.model.FlakyTestEntry;
import com.testinsight.model.RunRecord;
import com.testinsight.model.TestResult;
import com.testinsight.model.enums.TestStatus;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ranks tests whose pass/fail outcome changes across runs. Skipped results are ignored.
 */
@Component
public class FlakyTestDetector {

    private static final Comparator<FlakyTestEntry> RANKING = Comparator
            .comparingInt(FlakyTestEntry::getFlipCount).reversed()
            .thenComparingDouble(FlakyTestEntry::getFlakyRate)
            .thenComparing(FlakyTestEntry::getSuiteName)
            .thenComparing(FlakyTestEntry::getTestName);

    public List<FlakyTestEntry> detect(List<RunRecord> runs, List<TestResult> results,
                                       AggregationKey key, LocalDateTime computedAt) {
        Map<UUID, RunRecord> runsById = runs.stream()
                .collect(Collectors.toMap(RunRecord::getId, Function.identity()));
        Comparator<TestResult> chronological = Comparator
                .comparing((TestResult r) -> runsById.get(r.getRunId()).getFinishedAt())
                .thenComparing(r -> r.getRunId().toString());

        Map<TestKey, List<TestResult>> byTest = new HashMap<>();
        for (TestResult result : results) {
            if (result.getStatus() == TestStatus.SKIP || !runsById.containsKey(result.getRunId())) continue;
            byTest.computeIfAbsent(TestKey.of(result), k -> new ArrayList<>()).add(result);
        }

        List<FlakyTestEntry> flaky = new ArrayList<>();
        byTest.forEach((test, history) -> {
            List<TestStatus> statuses = history.stream().sorted(chronological).map(TestResult::getStatus).toList();
            int flips = StatusTransitions.countFlips(statuses);
            if (flips == 0) return;
            int passes = (int) statuses.stream().filter(s -> s == TestStatus.PASS).count();
            flaky.add(FlakyTestEntry.builder()
                    .windowDays(key.windowDays())
                    .scopeKey(key.scopeKey())
                    .testName(test.testName())
                    .suiteName(test.suiteName())
                    .totalRuns(statuses.size())
                    .passCount(passes)
                    .failCount(statuses.size() - passes)
                    .flipCount(flips)
                    .flakyRate(Rounding.percentage(passes, statuses.size()))
                    .lastStatus(statuses.get(statuses.size() - 1))
                    .computedAt(computedAt)
                    .build());
        });

        flaky.sort(RANKING);
        for (int i = 0; i < flaky.size(); i++) {
            flaky.get(i).setRank(i + 1);
        }
        return flaky;
    }
}
