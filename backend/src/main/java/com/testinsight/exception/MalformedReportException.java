package com.testinsight.exception;

import java.util.UUID;

public class MalformedReportException extends RuntimeException {

    private final UUID runId;

    public MalformedReportException(UUID runId, String message) {
        super("Malformed report for run " + runId + ": " + message);
        this.runId = runId;
    }

    public UUID getRunId() {
        return runId;
    }
}
