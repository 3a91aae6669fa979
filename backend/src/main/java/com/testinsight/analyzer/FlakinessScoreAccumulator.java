package com.testinsight.analyzer;

import com.testinsight.model.TestResult;
import com.testinsight.model.enums.TestStatus;

import java.time.LocalDateTime;
import java.util.*;

/**
 * Score = status transitions / (runs - 1), over each test's results in run finish order.
 */
public class FlakinessScoreAccumulator implements KpiAccumulator<FlakinessScoreAccumulator.Result> {

    private static final int LISTED_TESTS = 30;
    private static final int TIMELINE_LENGTH = 20;

    public record TestFlakiness(String testName, String suiteName, int totalRuns, int transitions,
                                double flakinessScore, List<String> timeline) {}

    public record Result(int totalTests, List<TestFlakiness> tests) {}

    private record Observation(LocalDateTime finishedAt, String runId, TestStatus status) {}

    private static final Comparator<Observation> CHRONOLOGICAL = Comparator
            .comparing(Observation::finishedAt)
            .thenComparing(Observation::runId);

    private final Map<TestKey, List<Observation>> observations = new HashMap<>();

    @Override
    public void fold(ReportData report) {
        for (TestResult test : report.tests()) {
            observations.computeIfAbsent(TestKey.of(test), k -> new ArrayList<>())
                    .add(new Observation(report.run().getFinishedAt(), report.run().getId().toString(), test.getStatus()));
        }
    }

    @Override
    public Result finish() {
        List<TestFlakiness> scored = new ArrayList<>();
        observations.forEach((key, list) -> {
            if (list.size() < 2) return;
            List<TestStatus> statuses = list.stream().sorted(CHRONOLOGICAL).map(Observation::status).toList();
            int transitions = StatusTransitions.countFlips(statuses);
            double score = Rounding.round((double) transitions / (statuses.size() - 1), 3);
            List<String> timeline = statuses.subList(Math.max(0, statuses.size() - TIMELINE_LENGTH), statuses.size())
                    .stream().map(Enum::name).toList();
            scored.add(new TestFlakiness(key.testName(), key.suiteName(), statuses.size(), transitions, score, timeline));
        });

        List<TestFlakiness> flaky = scored.stream()
                .filter(t -> t.flakinessScore() > 0)
                .sorted(Comparator.comparingDouble(TestFlakiness::flakinessScore).reversed()
                        .thenComparing(TestFlakiness::testName)
                        .thenComparing(TestFlakiness::suiteName))
                .limit(LISTED_TESTS)
                .toList();
        return new Result(scored.size(), flaky);
    }
}
