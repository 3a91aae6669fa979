package com.testinsight.service;

import com.testinsight.model.AnalysisJob;
import com.testinsight.model.enums.JobStatus;
import com.testinsight.repository.AnalysisJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Persists job state transitions. Terminal jobs are never modified again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnalysisJobStateStore {

    private final AnalysisJobRepository repository;
    private final Clock clock;

    /**
     * Moves a pending job to running. Returns false if the job is gone or no longer pending.
     */
    @Transactional
    public boolean markRunning(UUID jobId) {
        AnalysisJob job = repository.findById(jobId).orElse(null);
        if (job == null || job.getStatus() != JobStatus.PENDING) return false;
        job.setStatus(JobStatus.RUNNING);
        job.setStartedAt(LocalDateTime.now(clock));
        repository.save(job);
        return true;
    }

    @Transactional
    public void recordProgress(UUID jobId, int reportsAnalyzed, int progress) {
        AnalysisJob job = repository.findById(jobId).orElse(null);
        if (job == null || job.getStatus() != JobStatus.RUNNING) return;
        job.setReportsAnalyzed(reportsAnalyzed);
        job.setProgress(Math.max(job.getProgress(), progress));
        repository.save(job);
    }

    @Transactional
    public void complete(UUID jobId, int reportsAnalyzed, String results) {
        AnalysisJob job = repository.findById(jobId).orElse(null);
        if (job == null || job.getStatus().isTerminal()) return;
        job.setStatus(JobStatus.COMPLETED);
        job.setReportsAnalyzed(reportsAnalyzed);
        job.setResults(results);
        job.setProgress(100);
        job.setCompletedAt(LocalDateTime.now(clock));
        repository.save(job);
    }

    @Transactional
    public void fail(UUID jobId, int reportsAnalyzed, String errorMessage) {
        AnalysisJob job = repository.findById(jobId).orElse(null);
        if (job == null) return;
        if (job.getStatus().isTerminal()) {
            log.warn("Job {} already {}, ignoring failure: {}", jobId, job.getStatus(), errorMessage);
            return;
        }
        job.setStatus(JobStatus.ERROR);
        job.setReportsAnalyzed(Math.max(job.getReportsAnalyzed(), reportsAnalyzed));
        job.setErrorMessage(errorMessage);
        job.setCompletedAt(LocalDateTime.now(clock));
        repository.save(job);
    }
}
