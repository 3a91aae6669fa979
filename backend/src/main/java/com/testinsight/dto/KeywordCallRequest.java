package com.testinsight.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.*;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KeywordCallRequest {

    @NotBlank(message = "Keyword name is required")
    private String keywordName;

    private String libraryName; // optional, resolved from the catalog when missing

    @NotNull(message = "Start time is required")
    private LocalDateTime startTime;

    @PositiveOrZero
    private double durationSeconds;

    @Min(value = 0, message = "Depth must be zero or positive")
    private int depth;
}
