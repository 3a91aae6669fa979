package com.testinsight.service;

import com.testinsight.analyzer.ReportData;
import com.testinsight.model.KeywordCall;
import com.testinsight.model.RunRecord;
import com.testinsight.model.TestResult;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to finished runs and their parsed results.
 */
public interface ReportStore {

    /**
     * Finished runs whose finish time lies in {@code [from, to]}, oldest first.
     * Null bounds and a null repository leave that side of the filter open.
     */
    List<RunRecord> listRuns(UUID repositoryId, LocalDateTime from, LocalDateTime to);

    List<TestResult> getTestResults(UUID runId);

    List<TestResult> getTestResults(Collection<UUID> runIds);

    List<KeywordCall> getKeywordCalls(UUID runId);

    Optional<LocalDateTime> latestFinishedAt(UUID repositoryId);

    default ReportData loadReport(RunRecord run) {
        return new ReportData(run, getTestResults(run.getId()), getKeywordCalls(run.getId()));
    }
}
