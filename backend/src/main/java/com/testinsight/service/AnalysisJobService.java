package com.testinsight.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.testinsight.dto.AnalysisJobResponse;
import com.testinsight.dto.AnalysisRequest;
import com.testinsight.dto.KpiMetaResponse;
import com.testinsight.exception.NotFoundException;
import com.testinsight.model.AnalysisJob;
import com.testinsight.model.enums.JobStatus;
import com.testinsight.model.enums.KpiType;
import com.testinsight.repository.AnalysisJobRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisJobService {

    private static final String INTERRUPTED = "Interrupted by restart";

    private final AnalysisJobRepository repository;
    private final AnalysisJobRunner runner;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Jobs left pending or running by a previous process have no task to finish them.
     */
    @PostConstruct
    public void recoverInterruptedJobs() {
        List<AnalysisJob> orphaned = repository.findByStatusIn(List.of(JobStatus.PENDING, JobStatus.RUNNING));
        if (orphaned.isEmpty()) return;
        LocalDateTime now = LocalDateTime.now(clock);
        for (AnalysisJob job : orphaned) {
            job.setStatus(JobStatus.ERROR);
            job.setErrorMessage(INTERRUPTED);
            job.setCompletedAt(now);
        }
        repository.saveAll(orphaned);
        log.info("Marked {} interrupted analysis jobs as failed", orphaned.size());
    }

    public List<KpiMetaResponse> kpiCatalog() {
        return Arrays.stream(KpiType.values()).map(KpiMetaResponse::from).toList();
    }

    // Not transactional: the job row must be committed before a worker picks it up.
    public AnalysisJobResponse create(AnalysisRequest req) {
        List<String> requested = req.getSelectedKpis() == null ? List.of()
                : req.getSelectedKpis().stream().filter(Objects::nonNull).distinct().toList();
        if (requested.isEmpty()) {
            throw new IllegalArgumentException("At least one KPI must be selected");
        }
        if (req.getDateFrom() != null && req.getDateTo() != null && req.getDateFrom().isAfter(req.getDateTo())) {
            throw new IllegalArgumentException("dateFrom must not be after dateTo");
        }

        List<KpiType> kpis = new ArrayList<>();
        for (String id : requested) {
            KpiType.fromId(id).ifPresentOrElse(kpis::add, () -> log.debug("Ignoring unknown KPI '{}'", id));
        }

        AnalysisJob job = AnalysisJob.builder()
                .repositoryId(req.getRepositoryId())
                .selectedKpis(writeJson(requested))
                .dateFrom(req.getDateFrom())
                .dateTo(req.getDateTo())
                .status(JobStatus.PENDING)
                .createdAt(LocalDateTime.now(clock))
                .build();
        job = repository.save(job);
        AnalysisJobResponse response = toResponse(job);
        log.info("Created analysis job {} with {} KPIs", job.getId(), kpis.size());

        runner.submit(new AnalysisJobRunner.Plan(job.getId(), job.getRepositoryId(), List.copyOf(kpis),
                job.getDateFrom(), job.getDateTo()));
        return response;
    }

    @Transactional(readOnly = true)
    public AnalysisJobResponse findById(UUID id) {
        return repository.findById(id)
                .map(this::toResponse)
                .orElseThrow(() -> new NotFoundException("Analysis job not found: " + id));
    }

    @Transactional(readOnly = true)
    public List<AnalysisJobResponse> findAll(UUID repositoryId) {
        List<AnalysisJob> jobs = repositoryId == null
                ? repository.findAllByOrderByCreatedAtDesc()
                : repository.findByRepositoryIdOrderByCreatedAtDesc(repositoryId);
        return jobs.stream().map(this::toResponse).toList();
    }

    private AnalysisJobResponse toResponse(AnalysisJob job) {
        AnalysisJobResponse.AnalysisJobResponseBuilder resp = AnalysisJobResponse.builder()
                .id(job.getId())
                .repositoryId(job.getRepositoryId())
                .selectedKpis(List.of())
                .dateFrom(job.getDateFrom())
                .dateTo(job.getDateTo())
                .status(job.getStatus().name())
                .progress(job.getProgress())
                .reportsAnalyzed(job.getReportsAnalyzed())
                .errorMessage(job.getErrorMessage())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .createdAt(job.getCreatedAt());
        try {
            if (job.getSelectedKpis() != null) {
                resp.selectedKpis(objectMapper.readValue(job.getSelectedKpis(), new TypeReference<List<String>>() {}));
            }
            if (job.getResults() != null) {
                resp.results(objectMapper.readTree(job.getResults()));
            }
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize analysis job {}: {}", job.getId(), e.getMessage());
        }
        return resp.build();
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize KPI selection", e);
        }
    }
}
