package com.testinsight.repository;

import com.testinsight.model.KeywordCall;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface KeywordCallRepository extends JpaRepository<KeywordCall, UUID> {

    List<KeywordCall> findByRunIdOrderByStartTimeAsc(UUID runId);
}
