package com.testinsight.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.testinsight.config.AnalyticsProperties;
import com.testinsight.dto.*;
import com.testinsight.model.AggregationWatermark;
import com.testinsight.model.OverviewSnapshot;
import com.testinsight.repository.AggregationWatermarkRepository;
import com.testinsight.repository.FlakyTestEntryRepository;
import com.testinsight.repository.OverviewSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads cached statistics. Never triggers a recompute.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class StatsQueryService {

    private final OverviewSnapshotRepository snapshotRepository;
    private final FlakyTestEntryRepository flakyRepository;
    private final AggregationWatermarkRepository watermarkRepository;
    private final ReportStore reportStore;
    private final AnalyticsProperties properties;
    private final ObjectMapper objectMapper;

    public OverviewResponse overview(int windowDays, UUID repositoryId) {
        return snapshot(windowDays, repositoryId)
                .map(OverviewResponse::from)
                .orElseGet(() -> OverviewResponse.empty(windowDays, repositoryId));
    }

    public List<TrendPoint> trends(int windowDays, UUID repositoryId) {
        return snapshot(windowDays, repositoryId)
                .map(s -> readSeries(s.getTrendData(), new TypeReference<List<TrendPoint>>() {}))
                .orElse(List.of());
    }

    public List<SuccessRatePoint> successRate(int windowDays, UUID repositoryId) {
        return snapshot(windowDays, repositoryId)
                .map(s -> readSeries(s.getSuccessRateData(), new TypeReference<List<SuccessRatePoint>>() {}))
                .orElse(List.of());
    }

    public List<FlakyTestResponse> flaky(int windowDays, UUID repositoryId, int minRuns) {
        AggregationKey key = AggregationKey.of(windowDays, repositoryId, properties.getAllowedWindows());
        return flakyRepository.findByWindowDaysAndScopeKeyOrderByRankAsc(key.windowDays(), key.scopeKey()).stream()
                .filter(e -> e.getTotalRuns() >= minRuns)
                .map(FlakyTestResponse::from)
                .toList();
    }

    public AggregationStatusResponse aggregationStatus(UUID repositoryId) {
        Optional<AggregationWatermark> watermark = watermarkRepository.findById(AggregationWatermark.GLOBAL_ID);
        LocalDateTime latest = reportStore.latestFinishedAt(repositoryId).orElse(null);
        LocalDateTime computedAt = watermark.map(AggregationWatermark::getComputedAt).orElse(null);
        boolean stale = latest != null && (computedAt == null || latest.isAfter(computedAt));
        return AggregationStatusResponse.builder()
                .computedAt(computedAt)
                .windowDays(watermark.map(AggregationWatermark::getWindowDays).orElse(null))
                .repositoryId(watermark.map(AggregationWatermark::getRepositoryId).orElse(null))
                .latestRunFinishedAt(latest)
                .stale(stale)
                .build();
    }

    private Optional<OverviewSnapshot> snapshot(int windowDays, UUID repositoryId) {
        AggregationKey key = AggregationKey.of(windowDays, repositoryId, properties.getAllowedWindows());
        return snapshotRepository.findByWindowDaysAndScopeKey(key.windowDays(), key.scopeKey());
    }

    private <T> List<T> readSeries(String json, TypeReference<List<T>> type) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize cached series: {}", e.getMessage());
            return List.of();
        }
    }
}
