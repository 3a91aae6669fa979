package com.testinsight.repository;

import com.testinsight.model.OverviewSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface OverviewSnapshotRepository extends JpaRepository<OverviewSnapshot, UUID> {

    Optional<OverviewSnapshot> findByWindowDaysAndScopeKey(int windowDays, String scopeKey);
}
