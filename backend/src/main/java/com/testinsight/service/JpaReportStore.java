package com.testinsight.service;

import com.testinsight.model.KeywordCall;
import com.testinsight.model.RunRecord;
import com.testinsight.model.TestResult;
import com.testinsight.repository.KeywordCallRepository;
import com.testinsight.repository.RunRecordRepository;
import com.testinsight.repository.TestResultRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.*;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaReportStore implements ReportStore {

    // Keeps IN lists below common driver parameter limits.
    private static final int IN_CHUNK = 1000;

    private final RunRecordRepository runRepository;
    private final TestResultRepository testResultRepository;
    private final KeywordCallRepository keywordCallRepository;

    @Override
    public List<RunRecord> listRuns(UUID repositoryId, LocalDateTime from, LocalDateTime to) {
        Specification<RunRecord> spec = (root, query, cb) -> cb.isNotNull(root.get("finishedAt"));
        if (repositoryId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("repositoryId"), repositoryId));
        }
        if (from != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.get("finishedAt"), from));
        }
        if (to != null) {
            spec = spec.and((root, query, cb) -> cb.lessThanOrEqualTo(root.get("finishedAt"), to));
        }
        return runRepository.findAll(spec, Sort.by("finishedAt", "id").ascending());
    }

    @Override
    public List<TestResult> getTestResults(UUID runId) {
        return testResultRepository.findByRunId(runId);
    }

    @Override
    public List<TestResult> getTestResults(Collection<UUID> runIds) {
        if (runIds.isEmpty()) return List.of();
        List<UUID> ids = new ArrayList<>(runIds);
        List<TestResult> results = new ArrayList<>();
        for (int i = 0; i < ids.size(); i += IN_CHUNK) {
            results.addAll(testResultRepository.findByRunIdIn(ids.subList(i, Math.min(ids.size(), i + IN_CHUNK))));
        }
        return results;
    }

    @Override
    public List<KeywordCall> getKeywordCalls(UUID runId) {
        return keywordCallRepository.findByRunIdOrderByStartTimeAsc(runId);
    }

    @Override
    public Optional<LocalDateTime> latestFinishedAt(UUID repositoryId) {
        Optional<RunRecord> latest = repositoryId == null
                ? runRepository.findTopByFinishedAtNotNullOrderByFinishedAtDesc()
                : runRepository.findTopByRepositoryIdAndFinishedAtNotNullOrderByFinishedAtDesc(repositoryId);
        return latest.map(RunRecord::getFinishedAt);
    }
}
