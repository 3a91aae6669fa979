package com.testinsight.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "keyword_calls", indexes = @Index(name = "idx_keyword_calls_run", columnList = "run_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KeywordCall {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Column(name = "test_name", nullable = false, length = 500)
    private String testName;

    @Column(name = "suite_name", length = 500)
    private String suiteName;

    @Column(name = "keyword_name", nullable = false, length = 500)
    private String keywordName;

    // Absent in some report formats; resolved from the keyword catalog when null.
    @Column(name = "library_name", length = 200)
    private String libraryName;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "duration_seconds", nullable = false)
    @Builder.Default
    private double durationSeconds = 0.0;

    @Column(nullable = false)
    @Builder.Default
    private int depth = 0;
}
