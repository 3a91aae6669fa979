package com.testinsight.dto;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisRequest {

    private UUID repositoryId;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<String> selectedKpis = new ArrayList<>();

    private LocalDate dateFrom;
    private LocalDate dateTo;
}
