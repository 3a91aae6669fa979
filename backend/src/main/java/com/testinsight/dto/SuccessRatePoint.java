package com.testinsight.dto;

import lombok.*;

import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SuccessRatePoint {
    private LocalDate date;
    private double successRate;
    private long totalRuns;
}
