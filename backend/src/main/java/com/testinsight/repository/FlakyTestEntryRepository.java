package com.testinsight.repository;

import com.testinsight.model.FlakyTestEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface FlakyTestEntryRepository extends JpaRepository<FlakyTestEntry, UUID> {

    List<FlakyTestEntry> findByWindowDaysAndScopeKeyOrderByRankAsc(int windowDays, String scopeKey);

    @Modifying
    @Query("DELETE FROM FlakyTestEntry f WHERE f.windowDays = :windowDays AND f.scopeKey = :scopeKey")
    int deleteByWindowAndScope(@Param("windowDays") int windowDays, @Param("scopeKey") String scopeKey);
}
