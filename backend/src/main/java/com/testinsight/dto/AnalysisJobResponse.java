package com.testinsight.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisJobResponse {
    private UUID id;
    private UUID repositoryId;
    private List<String> selectedKpis;
    private LocalDate dateFrom;
    private LocalDate dateTo;
    private String status;
    private int progress;
    private int reportsAnalyzed;
    private String errorMessage;
    private JsonNode results;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime createdAt;
}
