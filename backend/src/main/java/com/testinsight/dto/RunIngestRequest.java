package com.testinsight.dto;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.testinsight.model.enums.RunStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunIngestRequest {

    @NotNull(message = "Repository is required")
    private UUID repositoryId;

    @NotNull(message = "Start time is required")
    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    @NotNull(message = "Status is required")
    private RunStatus status;

    @Valid
    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<TestResultRequest> tests = new ArrayList<>();
}
