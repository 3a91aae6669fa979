package com.testinsight.controller;

import com.testinsight.dto.*;
import com.testinsight.service.AggregationService;
import com.testinsight.service.StatsQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/stats")
@RequiredArgsConstructor
public class StatsController {

    private final AggregationService aggregationService;
    private final StatsQueryService statsQueryService;

    @PostMapping("/aggregate")
    public OverviewResponse aggregate(@RequestParam(defaultValue = "30") int days,
                                      @RequestParam(required = false) UUID repositoryId) {
        return aggregationService.aggregate(days, repositoryId);
    }

    @GetMapping("/overview")
    public OverviewResponse overview(@RequestParam(defaultValue = "30") int days,
                                     @RequestParam(required = false) UUID repositoryId) {
        return statsQueryService.overview(days, repositoryId);
    }

    @GetMapping("/trends")
    public List<TrendPoint> trends(@RequestParam(defaultValue = "30") int days,
                                   @RequestParam(required = false) UUID repositoryId) {
        return statsQueryService.trends(days, repositoryId);
    }

    @GetMapping("/success-rate")
    public List<SuccessRatePoint> successRate(@RequestParam(defaultValue = "30") int days,
                                              @RequestParam(required = false) UUID repositoryId) {
        return statsQueryService.successRate(days, repositoryId);
    }

    @GetMapping("/flaky")
    public List<FlakyTestResponse> flaky(@RequestParam(defaultValue = "30") int days,
                                         @RequestParam(required = false) UUID repositoryId,
                                         @RequestParam(defaultValue = "2") int minRuns) {
        return statsQueryService.flaky(days, repositoryId, minRuns);
    }

    @GetMapping("/aggregation-status")
    public AggregationStatusResponse aggregationStatus(@RequestParam(required = false) UUID repositoryId) {
        return statsQueryService.aggregationStatus(repositoryId);
    }
}
