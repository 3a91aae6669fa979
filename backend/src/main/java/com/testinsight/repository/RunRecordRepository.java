package com.testinsight.repository;

import com.testinsight.model.RunRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Optional;
import java.util.UUID;

public interface RunRecordRepository extends JpaRepository<RunRecord, UUID>, JpaSpecificationExecutor<RunRecord> {

    Optional<RunRecord> findTopByFinishedAtNotNullOrderByFinishedAtDesc();

    Optional<RunRecord> findTopByRepositoryIdAndFinishedAtNotNullOrderByFinishedAtDesc(UUID repositoryId);
}
