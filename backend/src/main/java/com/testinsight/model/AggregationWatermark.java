package com.testinsight.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * The single "last aggregated" marker. Readers compare it against the newest finished run.
 */
@Entity
@Table(name = "aggregation_watermark")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AggregationWatermark {

    public static final String GLOBAL_ID = "global";

    @Id
    @Column(length = 20)
    private String id;

    @Column(name = "computed_at", nullable = false)
    private LocalDateTime computedAt;

    @Column(name = "window_days", nullable = false)
    private int windowDays;

    @Column(name = "repository_id")
    private UUID repositoryId;

    @Version
    private long version;
}
