package com.testinsight.service;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which jobs currently own an execution task. At most one task per job id.
 */
@Component
public class AnalysisJobRegistry {

    private final Set<UUID> activeJobs = ConcurrentHashMap.newKeySet();

    /**
     * Claim a job for execution. Returns false when another task already owns it.
     */
    public boolean claim(UUID jobId) {
        return activeJobs.add(jobId);
    }

    public void release(UUID jobId) {
        activeJobs.remove(jobId);
    }
}
