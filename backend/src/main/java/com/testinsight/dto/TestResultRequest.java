package com.testinsight.dto;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.testinsight.model.enums.TestStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TestResultRequest {

    @NotBlank(message = "Test name is required")
    @Size(max = 500, message = "Test name must not exceed 500 characters")
    private String testName;

    @NotBlank(message = "Suite name is required")
    @Size(max = 500, message = "Suite name must not exceed 500 characters")
    private String suiteName;

    @NotNull(message = "Status is required")
    private TestStatus status;

    @PositiveOrZero
    private double durationSeconds;

    private String errorMessage;

    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<String> tags = new ArrayList<>();

    @Valid
    @Builder.Default
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<KeywordCallRequest> keywords = new ArrayList<>();
}
