package com.testinsight.analyzer;

import com.testinsight.model.KeywordCall;
import com.testinsight.model.TestResult;

import java.util.Comparator;

/**
 * Identifies a logical test across runs.
 */
public record TestKey(String suiteName, String testName) implements Comparable<TestKey> {

    private static final Comparator<TestKey> ORDER = Comparator
            .comparing(TestKey::testName)
            .thenComparing(TestKey::suiteName);

    public static TestKey of(TestResult result) {
        return new TestKey(result.getSuiteName() != null ? result.getSuiteName() : "", result.getTestName());
    }

    /** The test a keyword call was executed under. */
    public static TestKey of(KeywordCall call) {
        return new TestKey(call.getSuiteName() != null ? call.getSuiteName() : "", call.getTestName());
    }

    @Override
    public int compareTo(TestKey other) {
        return ORDER.compare(this, other);
    }
}
