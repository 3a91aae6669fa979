package com.testinsight.dto;

import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AggregationStatusResponse {
    private LocalDateTime computedAt;
    private Integer windowDays;
    private UUID repositoryId;
    private LocalDateTime latestRunFinishedAt;
    private boolean stale;
}
