package com.testinsight.model.enums;

public enum JobStatus {
    PENDING, RUNNING, COMPLETED, ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }
}
