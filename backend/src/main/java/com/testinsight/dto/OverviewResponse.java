package com.testinsight.dto;

import com.testinsight.model.OverviewSnapshot;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OverviewResponse {

    private int windowDays;
    private UUID repositoryId;
    private long totalRuns;
    private long passedRuns;
    private long failedRuns;
    private double successRate;
    private double avgDurationSeconds;
    private long totalTests;
    private long flakyTests;
    private long activeRepos;
    private LocalDateTime computedAt; // null until the first aggregation of this filter

    public static OverviewResponse from(OverviewSnapshot snapshot) {
        return OverviewResponse.builder()
                .windowDays(snapshot.getWindowDays())
                .repositoryId(snapshot.getRepositoryId())
                .totalRuns(snapshot.getTotalRuns())
                .passedRuns(snapshot.getPassedRuns())
                .failedRuns(snapshot.getFailedRuns())
                .successRate(snapshot.getSuccessRate())
                .avgDurationSeconds(snapshot.getAvgDurationSeconds())
                .totalTests(snapshot.getTotalTests())
                .flakyTests(snapshot.getFlakyTests())
                .activeRepos(snapshot.getActiveRepos())
                .computedAt(snapshot.getComputedAt())
                .build();
    }

    public static OverviewResponse empty(int windowDays, UUID repositoryId) {
        return OverviewResponse.builder()
                .windowDays(windowDays)
                .repositoryId(repositoryId)
                .build();
    }
}
