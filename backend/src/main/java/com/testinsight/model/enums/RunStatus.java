package com.testinsight.model.enums;

public enum RunStatus {
    PASSED, FAILED, ERROR, CANCELLED, TIMEOUT
}
