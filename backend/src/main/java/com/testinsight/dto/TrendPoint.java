package com.testinsight.dto;

import lombok.*;

import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrendPoint {
    private LocalDate date;
    private long passed;
    private long failed;
    private long error;
    private long total;
    private double avgDuration;
}
