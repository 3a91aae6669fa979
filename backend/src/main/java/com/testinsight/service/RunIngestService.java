package com.testinsight.service;

import com.testinsight.dto.KeywordCallRequest;
import com.testinsight.dto.RunIngestRequest;
import com.testinsight.dto.RunRecordResponse;
import com.testinsight.dto.TestResultRequest;
import com.testinsight.exception.NotFoundException;
import com.testinsight.model.KeywordCall;
import com.testinsight.model.RunRecord;
import com.testinsight.model.TestResult;
import com.testinsight.repository.KeywordCallRepository;
import com.testinsight.repository.RunRecordRepository;
import com.testinsight.repository.TestResultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Stores already-parsed runs so the analytics engine can read them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RunIngestService {

    private final RunRecordRepository runRepository;
    private final TestResultRepository testResultRepository;
    private final KeywordCallRepository keywordCallRepository;

    @Transactional
    public RunRecordResponse ingest(RunIngestRequest req) {
        if (req.getFinishedAt() != null && req.getFinishedAt().isBefore(req.getStartedAt())) {
            throw new IllegalArgumentException("finishedAt must not be before startedAt");
        }

        RunRecord run = runRepository.save(RunRecord.builder()
                .repositoryId(req.getRepositoryId())
                .startedAt(req.getStartedAt())
                .finishedAt(req.getFinishedAt())
                .status(req.getStatus())
                .build());

        List<TestResult> results = new ArrayList<>();
        List<KeywordCall> calls = new ArrayList<>();
        for (TestResultRequest test : req.getTests()) {
            results.add(TestResult.builder()
                    .runId(run.getId())
                    .testName(test.getTestName())
                    .suiteName(test.getSuiteName())
                    .status(test.getStatus())
                    .durationSeconds(test.getDurationSeconds())
                    .errorMessage(test.getErrorMessage())
                    .tags(new ArrayList<>(test.getTags()))
                    .build());
            for (KeywordCallRequest kw : test.getKeywords()) {
                calls.add(KeywordCall.builder()
                        .runId(run.getId())
                        .testName(test.getTestName())
                        .suiteName(test.getSuiteName())
                        .keywordName(kw.getKeywordName())
                        .libraryName(kw.getLibraryName() != null && !kw.getLibraryName().isBlank() ? kw.getLibraryName() : null)
                        .startTime(kw.getStartTime())
                        .durationSeconds(kw.getDurationSeconds())
                        .depth(kw.getDepth())
                        .build());
            }
        }
        testResultRepository.saveAll(results);
        keywordCallRepository.saveAll(calls);

        log.info("Ingested run {} for repository {}: {} tests, {} keyword calls",
                run.getId(), run.getRepositoryId(), results.size(), calls.size());
        return RunRecordResponse.from(run, results.size());
    }

    @Transactional(readOnly = true)
    public RunRecordResponse findById(UUID id) {
        RunRecord run = runRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Run not found: " + id));
        return RunRecordResponse.from(run, testResultRepository.countByRunId(id));
    }
}
