package com.testinsight.repository;

import com.testinsight.model.AnalysisJob;
import com.testinsight.model.enums.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface AnalysisJobRepository extends JpaRepository<AnalysisJob, UUID> {

    List<AnalysisJob> findAllByOrderByCreatedAtDesc();

    List<AnalysisJob> findByRepositoryIdOrderByCreatedAtDesc(UUID repositoryId);

    List<AnalysisJob> findByStatusIn(Collection<JobStatus> statuses);
}
