package com.testinsight.repository;

import com.testinsight.model.TestResult;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface TestResultRepository extends JpaRepository<TestResult, UUID> {

    List<TestResult> findByRunId(UUID runId);

    List<TestResult> findByRunIdIn(Collection<UUID> runIds);

    long countByRunId(UUID runId);
}
