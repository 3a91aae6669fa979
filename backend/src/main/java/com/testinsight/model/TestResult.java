package com.testinsight.model;

import com.testinsight.model.enums.TestStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "test_results", indexes = @Index(name = "idx_test_results_run", columnList = "run_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TestResult {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Column(name = "test_name", nullable = false, length = 500)
    private String testName;

    @Column(name = "suite_name", nullable = false, length = 500)
    private String suiteName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private TestStatus status;

    @Column(name = "duration_seconds", nullable = false)
    @Builder.Default
    private double durationSeconds = 0.0;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(columnDefinition = "jsonb", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private List<String> tags = new ArrayList<>();
}
