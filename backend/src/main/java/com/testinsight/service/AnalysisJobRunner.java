package com.testinsight.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.testinsight.analyzer.KpiAccumulator;
import com.testinsight.analyzer.KpiAccumulatorFactory;
import com.testinsight.analyzer.ReportData;
import com.testinsight.model.RunRecord;
import com.testinsight.model.enums.KpiType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.*;

/**
 * Executes deep-analysis jobs on the analysis worker pool.
 */
@Component
@Slf4j
public class AnalysisJobRunner {

    private static final int MAX_ERROR_LENGTH = 500;

    /** What a job analyzes, captured when it is created. */
    public record Plan(UUID jobId, UUID repositoryId, List<KpiType> kpis, LocalDate dateFrom, LocalDate dateTo) {}

    private final ReportStore reportStore;
    private final KpiAccumulatorFactory accumulatorFactory;
    private final AnalysisJobStateStore stateStore;
    private final AnalysisJobRegistry registry;
    private final ObjectMapper objectMapper;
    private final TaskExecutor executor;

    public AnalysisJobRunner(ReportStore reportStore,
                             KpiAccumulatorFactory accumulatorFactory,
                             AnalysisJobStateStore stateStore,
                             AnalysisJobRegistry registry,
                             ObjectMapper objectMapper,
                             @Qualifier("analysisExecutor") TaskExecutor executor) {
        this.reportStore = reportStore;
        this.accumulatorFactory = accumulatorFactory;
        this.stateStore = stateStore;
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    public void submit(Plan plan) {
        if (!registry.claim(plan.jobId())) {
            log.warn("Job {} is already executing", plan.jobId());
            return;
        }
        try {
            executor.execute(() -> {
                try {
                    execute(plan);
                } finally {
                    registry.release(plan.jobId());
                }
            });
        } catch (TaskRejectedException e) {
            registry.release(plan.jobId());
            log.warn("Analysis queue is full, rejecting job {}", plan.jobId());
            stateStore.fail(plan.jobId(), 0, "Analysis queue is full, try again later");
        }
    }

    void execute(Plan plan) {
        UUID jobId = plan.jobId();
        int analyzed = 0;
        try {
            if (!stateStore.markRunning(jobId)) {
                log.warn("Job {} is not pending, skipping execution", jobId);
                return;
            }
            log.info("Job {} started: kpis={}, repository={}, range={}..{}",
                    jobId, plan.kpis(), plan.repositoryId(), plan.dateFrom(), plan.dateTo());

            Map<KpiType, KpiAccumulator<?>> accumulators = new LinkedHashMap<>();
            for (KpiType kpi : plan.kpis()) {
                accumulators.put(kpi, accumulatorFactory.create(kpi, plan.repositoryId()));
            }

            List<RunRecord> runs = plan.kpis().stream().anyMatch(KpiType::needsReports)
                    ? reportStore.listRuns(plan.repositoryId(), startOf(plan.dateFrom()), endOf(plan.dateTo()))
                    : List.of();

            int processed = 0;
            for (RunRecord run : runs) {
                ReportData report = reportStore.loadReport(run);
                try {
                    report.validate();
                    for (KpiAccumulator<?> accumulator : accumulators.values()) {
                        accumulator.fold(report);
                    }
                    analyzed++;
                } catch (RuntimeException e) {
                    log.warn("Job {}: skipping report of run {}: {}", jobId, run.getId(), e.getMessage());
                }
                processed++;
                stateStore.recordProgress(jobId, analyzed, runningProgress(processed, runs.size()));
            }

            Map<String, Object> results = new LinkedHashMap<>();
            accumulators.forEach((kpi, accumulator) -> {
                try {
                    results.put(kpi.getId(), accumulator.finish());
                } catch (RuntimeException e) {
                    log.warn("Job {}: KPI {} failed: {}", jobId, kpi.getId(), e.getMessage());
                    results.put(kpi.getId(), Map.of("error", String.valueOf(e.getMessage())));
                }
            });

            stateStore.complete(jobId, analyzed, objectMapper.writeValueAsString(results));
            log.info("Job {} completed: {} of {} reports analyzed", jobId, analyzed, runs.size());
        } catch (Exception e) {
            log.error("Job {} aborted after {} reports", jobId, analyzed, e);
            stateStore.fail(jobId, analyzed, truncate(e.getMessage() != null ? e.getMessage() : e.toString()));
        }
    }

    /** Stays below 100 until the results are written. */
    static int runningProgress(int processed, int total) {
        if (total == 0) return 0;
        return (int) Math.min(99, Math.round(processed * 100.0 / total));
    }

    private static LocalDateTime startOf(LocalDate day) {
        return day != null ? day.atStartOfDay() : null;
    }

    private static LocalDateTime endOf(LocalDate day) {
        return day != null ? day.atTime(LocalTime.MAX) : null;
    }

    private static String truncate(String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
