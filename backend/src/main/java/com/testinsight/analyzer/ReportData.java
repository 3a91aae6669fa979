package com.testinsight.analyzer;

import com.testinsight.exception.MalformedReportException;
import com.testinsight.model.KeywordCall;
import com.testinsight.model.RunRecord;
import com.testinsight.model.TestResult;

import java.util.*;

/**
 * One finished run with its test results and keyword calls, as folded into KPI accumulators.
 */
public record ReportData(RunRecord run, List<TestResult> tests, List<KeywordCall> keywords) {

    public ReportData {
        tests = tests != null ? List.copyOf(tests) : List.of();
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
    }

    /**
     * Rejects records an accumulator could only fold partially.
     */
    public void validate() {
        if (run == null || run.getId() == null) {
            throw new MalformedReportException(null, "missing run");
        }
        UUID runId = run.getId();
        if (run.getFinishedAt() == null) {
            throw new MalformedReportException(runId, "run has not finished");
        }
        for (TestResult test : tests) {
            if (test.getTestName() == null || test.getStatus() == null) {
                throw new MalformedReportException(runId, "test result without name or status");
            }
            if (!runId.equals(test.getRunId())) {
                throw new MalformedReportException(runId, "test result '" + test.getTestName() + "' belongs to another run");
            }
        }
        for (KeywordCall call : keywords) {
            if (call.getKeywordName() == null || call.getTestName() == null || call.getStartTime() == null) {
                throw new MalformedReportException(runId, "keyword call without name, test or start time");
            }
            if (call.getDepth() < 0) {
                throw new MalformedReportException(runId, "negative depth for keyword '" + call.getKeywordName() + "'");
            }
            if (!runId.equals(call.getRunId())) {
                throw new MalformedReportException(runId, "keyword call '" + call.getKeywordName() + "' belongs to another run");
            }
        }
    }

    /** Keyword calls grouped by logical test, each list in execution order. */
    public Map<TestKey, List<KeywordCall>> keywordsByTest() {
        Map<TestKey, List<KeywordCall>> byTest = new HashMap<>();
        for (KeywordCall call : keywords) {
            byTest.computeIfAbsent(TestKey.of(call), k -> new ArrayList<>()).add(call);
        }
        byTest.values().forEach(calls -> calls.sort(Comparator.comparing(KeywordCall::getStartTime)));
        return byTest;
    }

    /** Ordered names of the depth-0 keywords of a test. */
    public static List<String> topLevelNames(List<KeywordCall> calls) {
        if (calls == null) return List.of();
        return calls.stream()
                .filter(c -> c.getDepth() == 0)
                .map(KeywordCall::getKeywordName)
                .toList();
    }
}
