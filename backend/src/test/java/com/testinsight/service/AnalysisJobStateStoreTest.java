package com.testinsight.service;

import com.testinsight.model.AnalysisJob;
import com.testinsight.model.enums.JobStatus;
import com.testinsight.repository.AnalysisJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnalysisJobStateStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-10T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private AnalysisJobRepository repository;

    private AnalysisJobStateStore store;
    private AnalysisJob job;

    @BeforeEach
    void setUp() {
        store = new AnalysisJobStateStore(repository, CLOCK);
        job = AnalysisJob.builder().id(UUID.randomUUID()).status(JobStatus.PENDING).build();
        when(repository.findById(job.getId())).thenReturn(Optional.of(job));
    }

    @Test
    void markRunning_PendingJob_StartsIt() {
        assertTrue(store.markRunning(job.getId()));
        assertEquals(JobStatus.RUNNING, job.getStatus());
        assertEquals(LocalDateTime.now(CLOCK), job.getStartedAt());
    }

    @Test
    void markRunning_NotPending_IsRefused() {
        job.setStatus(JobStatus.COMPLETED);

        assertFalse(store.markRunning(job.getId()));
        verify(repository, never()).save(any());
    }

    @Test
    void recordProgress_NeverDecreases() {
        job.setStatus(JobStatus.RUNNING);

        store.recordProgress(job.getId(), 5, 60);
        store.recordProgress(job.getId(), 6, 40);

        assertEquals(60, job.getProgress());
        assertEquals(6, job.getReportsAnalyzed());
    }

    @Test
    void complete_SetsFullProgressAndResults() {
        job.setStatus(JobStatus.RUNNING);

        store.complete(job.getId(), 3, "{}");

        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(100, job.getProgress());
        assertEquals(3, job.getReportsAnalyzed());
        assertEquals("{}", job.getResults());
        assertNotNull(job.getCompletedAt());
    }

    @Test
    void fail_TerminalJob_IsLeftUntouched() {
        job.setStatus(JobStatus.COMPLETED);
        job.setProgress(100);

        store.fail(job.getId(), 0, "late failure");

        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertNull(job.getErrorMessage());
        verify(repository, never()).save(any());
    }

    @Test
    void fail_RunningJob_KeepsAnalyzedCount() {
        job.setStatus(JobStatus.RUNNING);
        job.setReportsAnalyzed(4);

        store.fail(job.getId(), 4, "boom");

        assertEquals(JobStatus.ERROR, job.getStatus());
        assertEquals("boom", job.getErrorMessage());
        assertEquals(4, job.getReportsAnalyzed());
    }
}
