package com.testinsight.analyzer;

import com.testinsight.model.enums.TestStatus;

import java.util.List;

public final class StatusTransitions {

    private StatusTransitions() {
    }

    /**
     * Counts adjacent PASS→FAIL and FAIL→PASS changes in a chronologically ordered sequence.
     * Statuses other than PASS and FAIL neither count nor break adjacency.
     */
    public static int countFlips(List<TestStatus> chronological) {
        int flips = 0;
        TestStatus previous = null;
        for (TestStatus status : chronological) {
            if (status != TestStatus.PASS && status != TestStatus.FAIL) continue;
            if (previous != null && previous != status) flips++;
            previous = status;
        }
        return flips;
    }
}
