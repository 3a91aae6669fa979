package com.testinsight.service;

import com.testinsight.config.AnalyticsProperties;
import com.testinsight.dto.OverviewResponse;
import com.testinsight.exception.AggregationFailedException;
import com.testinsight.model.FlakyTestEntry;
import com.testinsight.model.OverviewSnapshot;
import com.testinsight.model.RunRecord;
import com.testinsight.model.TestResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recomputes the cached overview, trend series and flaky ranking of a (window, repository) filter.
 *
 * <p>Different filters aggregate concurrently. Calls for the same filter are serialized, so the
 * last caller's snapshot is the one that stays.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AggregationService {

    private final ReportStore reportStore;
    private final OverviewCalculator calculator;
    private final FlakyTestDetector flakyDetector;
    private final SnapshotWriter snapshotWriter;
    private final AnalyticsProperties properties;
    private final Clock clock;

    private final ConcurrentHashMap<AggregationKey, Object> locks = new ConcurrentHashMap<>();

    public OverviewResponse aggregate(int windowDays, UUID repositoryId) {
        AggregationKey key = AggregationKey.of(windowDays, repositoryId, properties.getAllowedWindows());
        synchronized (locks.computeIfAbsent(key, k -> new Object())) {
            return OverviewResponse.from(refresh(key));
        }
    }

    private OverviewSnapshot refresh(AggregationKey key) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime from = now.minusDays(key.windowDays());
        try {
            List<RunRecord> runs = reportStore.listRuns(key.repositoryId(), from, now);
            List<TestResult> results = reportStore.getTestResults(runs.stream().map(RunRecord::getId).toList());

            OverviewCalculator.Result overview = calculator.calculate(runs, results.size(),
                    from.toLocalDate(), now.toLocalDate());
            List<FlakyTestEntry> flaky = flakyDetector.detect(runs, results, key, now);

            OverviewSnapshot snapshot = snapshotWriter.write(key, overview, flaky, now);
            log.info("Aggregated {} days for {}: {} runs, {} tests, {} flaky",
                    key.windowDays(), key.scopeKey(), overview.totalRuns(), overview.totalTests(), flaky.size());
            return snapshot;
        } catch (RuntimeException e) {
            log.error("Aggregation of {} days for {} failed", key.windowDays(), key.scopeKey(), e);
            throw new AggregationFailedException("Aggregation failed, previous statistics are kept: " + e.getMessage(), e);
        }
    }
}
