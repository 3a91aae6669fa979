package com.testinsight.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.testinsight.dto.AnalysisJobResponse;
import com.testinsight.dto.AnalysisRequest;
import com.testinsight.exception.NotFoundException;
import com.testinsight.model.AnalysisJob;
import com.testinsight.model.enums.JobStatus;
import com.testinsight.model.enums.KpiType;
import com.testinsight.repository.AnalysisJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnalysisJobServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-10T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private AnalysisJobRepository repository;
    @Mock
    private AnalysisJobRunner runner;

    private AnalysisJobService service;

    @BeforeEach
    void setUp() {
        service = new AnalysisJobService(repository, runner, new ObjectMapper().findAndRegisterModules(), CLOCK);
    }

    @Test
    void create_EmptySelection_IsRejectedBeforeSaving() {
        AnalysisRequest request = AnalysisRequest.builder().selectedKpis(List.of()).build();

        assertThrows(IllegalArgumentException.class, () -> service.create(request));
        verifyNoInteractions(repository, runner);
    }

    @Test
    void create_InvertedDateRange_IsRejected() {
        AnalysisRequest request = AnalysisRequest.builder()
                .selectedKpis(List.of("keyword_frequency"))
                .dateFrom(LocalDate.of(2024, 3, 10))
                .dateTo(LocalDate.of(2024, 3, 1))
                .build();

        assertThrows(IllegalArgumentException.class, () -> service.create(request));
        verifyNoInteractions(repository, runner);
    }

    @Test
    void create_ReturnsPendingJobAndSubmitsKnownKpis() {
        UUID jobId = UUID.randomUUID();
        UUID repositoryId = UUID.randomUUID();
        when(repository.save(any(AnalysisJob.class))).thenAnswer(inv -> {
            AnalysisJob job = inv.getArgument(0);
            job.setId(jobId);
            return job;
        });

        AnalysisJobResponse response = service.create(AnalysisRequest.builder()
                .repositoryId(repositoryId)
                .selectedKpis(List.of("keyword_frequency", "no_such_kpi", "error_patterns", "keyword_frequency"))
                .build());

        assertEquals(jobId, response.getId());
        assertEquals("PENDING", response.getStatus());
        assertEquals(0, response.getProgress());
        assertEquals(0, response.getReportsAnalyzed());
        assertEquals(List.of("keyword_frequency", "no_such_kpi", "error_patterns"), response.getSelectedKpis());

        ArgumentCaptor<AnalysisJobRunner.Plan> plan = ArgumentCaptor.forClass(AnalysisJobRunner.Plan.class);
        verify(runner).submit(plan.capture());
        assertEquals(jobId, plan.getValue().jobId());
        assertEquals(repositoryId, plan.getValue().repositoryId());
        assertEquals(List.of(KpiType.KEYWORD_FREQUENCY, KpiType.ERROR_PATTERNS), plan.getValue().kpis());
    }

    @Test
    void findById_Missing_ThrowsNotFound() {
        UUID id = UUID.randomUUID();
        when(repository.findById(id)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.findById(id));
    }

    @Test
    void findById_CompletedJob_ExposesResults() {
        UUID id = UUID.randomUUID();
        when(repository.findById(id)).thenReturn(Optional.of(AnalysisJob.builder()
                .id(id)
                .selectedKpis("[\"tag_coverage\"]")
                .status(JobStatus.COMPLETED)
                .progress(100)
                .reportsAnalyzed(3)
                .results("{\"tag_coverage\":{\"totalTests\":4}}")
                .build()));

        AnalysisJobResponse response = service.findById(id);

        assertEquals("COMPLETED", response.getStatus());
        assertEquals(4, response.getResults().path("tag_coverage").path("totalTests").asInt());
    }

    @Test
    void findAll_FiltersByRepository() {
        UUID repositoryId = UUID.randomUUID();
        when(repository.findByRepositoryIdOrderByCreatedAtDesc(repositoryId)).thenReturn(List.of(
                AnalysisJob.builder().id(UUID.randomUUID()).repositoryId(repositoryId).build()));

        assertEquals(1, service.findAll(repositoryId).size());
        verify(repository, never()).findAllByOrderByCreatedAtDesc();
    }

    @Test
    void kpiCatalog_ListsAllKpis() {
        assertEquals(15, service.kpiCatalog().size());
        assertEquals("keywords", service.kpiCatalog().get(0).getCategory());
    }

    @Test
    void recoverInterruptedJobs_MarksOrphansAsError() {
        AnalysisJob running = AnalysisJob.builder().id(UUID.randomUUID()).status(JobStatus.RUNNING).progress(40).build();
        AnalysisJob pending = AnalysisJob.builder().id(UUID.randomUUID()).status(JobStatus.PENDING).build();
        when(repository.findByStatusIn(List.of(JobStatus.PENDING, JobStatus.RUNNING))).thenReturn(List.of(running, pending));

        service.recoverInterruptedJobs();

        assertEquals(JobStatus.ERROR, running.getStatus());
        assertEquals("Interrupted by restart", running.getErrorMessage());
        assertEquals(40, running.getProgress());
        assertEquals(JobStatus.ERROR, pending.getStatus());
        verify(repository).saveAll(List.of(running, pending));
    }
}
