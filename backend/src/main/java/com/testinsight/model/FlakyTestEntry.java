package com.testinsight.model;

import com.testinsight.model.enums.TestStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "flaky_test_entries",
        indexes = @Index(name = "idx_flaky_window_scope", columnList = "window_days, scope_key"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FlakyTestEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "window_days", nullable = false)
    private int windowDays;

    @Column(name = "scope_key", nullable = false, length = 40)
    private String scopeKey;

    @Column(name = "test_name", nullable = false, length = 500)
    private String testName;

    @Column(name = "suite_name", nullable = false, length = 500)
    private String suiteName;

    @Column(name = "total_runs", nullable = false)
    private int totalRuns;

    @Column(name = "pass_count", nullable = false)
    private int passCount;

    @Column(name = "fail_count", nullable = false)
    private int failCount;

    @Column(name = "flip_count", nullable = false)
    private int flipCount;

    @Column(name = "flaky_rate", nullable = false)
    private double flakyRate;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_status", nullable = false, length = 10)
    private TestStatus lastStatus;

    // Position in the detector's ranking.
    @Column(name = "rank_position", nullable = false)
    private int rank;

    @Column(name = "computed_at", nullable = false)
    private LocalDateTime computedAt;
}
