package com.testinsight.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Cached overview for one (window, repository scope) pair. Overwritten on every aggregation.
 */
@Entity
@Table(name = "overview_snapshots",
        uniqueConstraints = @UniqueConstraint(name = "uq_overview_window_scope", columnNames = {"window_days", "scope_key"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OverviewSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "window_days", nullable = false)
    private int windowDays;

    @Column(name = "scope_key", nullable = false, length = 40)
    private String scopeKey;

    @Column(name = "repository_id")
    private UUID repositoryId;

    @Column(name = "total_runs", nullable = false)
    private long totalRuns;

    @Column(name = "passed_runs", nullable = false)
    private long passedRuns;

    @Column(name = "failed_runs", nullable = false)
    private long failedRuns;

    @Column(name = "success_rate", nullable = false)
    private double successRate;

    @Column(name = "avg_duration_seconds", nullable = false)
    private double avgDurationSeconds;

    @Column(name = "total_tests", nullable = false)
    private long totalTests;

    @Column(name = "flaky_tests", nullable = false)
    private long flakyTests;

    @Column(name = "active_repos", nullable = false)
    private long activeRepos;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "trend_data", columnDefinition = "jsonb", nullable = false)
    @Builder.Default
    private String trendData = "[]";

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "success_rate_data", columnDefinition = "jsonb", nullable = false)
    @Builder.Default
    private String successRateData = "[]";

    @Column(name = "computed_at", nullable = false)
    private LocalDateTime computedAt;
}
