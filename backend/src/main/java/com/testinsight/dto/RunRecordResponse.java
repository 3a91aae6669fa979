package com.testinsight.dto;

import com.testinsight.model.RunRecord;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunRecordResponse {

    private UUID id;
    private UUID repositoryId;
    private String status;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private long testCount;
    private LocalDateTime createdAt;

    public static RunRecordResponse from(RunRecord run, long testCount) {
        return RunRecordResponse.builder()
                .id(run.getId())
                .repositoryId(run.getRepositoryId())
                .status(run.getStatus().name())
                .startedAt(run.getStartedAt())
                .finishedAt(run.getFinishedAt())
                .testCount(testCount)
                .createdAt(run.getCreatedAt())
                .build();
    }
}
