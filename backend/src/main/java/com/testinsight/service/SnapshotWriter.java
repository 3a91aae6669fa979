package com.testinsight.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.testinsight.model.AggregationWatermark;
import com.testinsight.model.FlakyTestEntry;
import com.testinsight.model.OverviewSnapshot;
import com.testinsight.repository.AggregationWatermarkRepository;
import com.testinsight.repository.FlakyTestEntryRepository;
import com.testinsight.repository.OverviewSnapshotRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Replaces the cached overview, flaky ranking and watermark of one key in a single transaction.
 */
@Component
@RequiredArgsConstructor
public class SnapshotWriter {

    private final OverviewSnapshotRepository snapshotRepository;
    private final FlakyTestEntryRepository flakyRepository;
    private final AggregationWatermarkRepository watermarkRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    public OverviewSnapshot write(AggregationKey key, OverviewCalculator.Result result,
                                  List<FlakyTestEntry> flaky, LocalDateTime computedAt) {
        OverviewSnapshot snapshot = snapshotRepository.findByWindowDaysAndScopeKey(key.windowDays(), key.scopeKey())
                .orElseGet(() -> OverviewSnapshot.builder()
                        .windowDays(key.windowDays())
                        .scopeKey(key.scopeKey())
                        .build());
        snapshot.setRepositoryId(key.repositoryId());
        snapshot.setTotalRuns(result.totalRuns());
        snapshot.setPassedRuns(result.passedRuns());
        snapshot.setFailedRuns(result.failedRuns());
        snapshot.setSuccessRate(result.successRate());
        snapshot.setAvgDurationSeconds(result.avgDurationSeconds());
        snapshot.setTotalTests(result.totalTests());
        snapshot.setFlakyTests(flaky.size());
        snapshot.setActiveRepos(result.activeRepos());
        snapshot.setTrendData(toJson(result.trend()));
        snapshot.setSuccessRateData(toJson(result.successRates()));
        snapshot.setComputedAt(computedAt);
        OverviewSnapshot saved = snapshotRepository.save(snapshot);

        flakyRepository.deleteByWindowAndScope(key.windowDays(), key.scopeKey());
        flakyRepository.saveAll(flaky);

        AggregationWatermark watermark = watermarkRepository.findById(AggregationWatermark.GLOBAL_ID)
                .orElseGet(() -> AggregationWatermark.builder().id(AggregationWatermark.GLOBAL_ID).build());
        watermark.setComputedAt(computedAt);
        watermark.setWindowDays(key.windowDays());
        watermark.setRepositoryId(key.repositoryId());
        watermarkRepository.save(watermark);

        return saved;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            // Rolls the transaction back; the previous snapshot stays in place.
            throw new IllegalStateException("Failed to serialize series: " + e.getMessage(), e);
        }
    }
}
