package com.testinsight.dto;

import com.testinsight.model.FlakyTestEntry;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FlakyTestResponse {

    private String testName;
    private String suiteName;
    private int totalRuns;
    private int passCount;
    private int failCount;
    private int flipCount;
    private double flakyRate;
    private String lastStatus;

    public static FlakyTestResponse from(FlakyTestEntry entry) {
        return FlakyTestResponse.builder()
                .testName(entry.getTestName())
                .suiteName(entry.getSuiteName())
                .totalRuns(entry.getTotalRuns())
                .passCount(entry.getPassCount())
                .failCount(entry.getFailCount())
                .flipCount(entry.getFlipCount())
                .flakyRate(entry.getFlakyRate())
                .lastStatus(entry.getLastStatus().name())
                .build();
    }
}
