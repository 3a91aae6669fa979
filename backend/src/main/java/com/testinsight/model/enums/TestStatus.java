package com.testinsight.model.enums;

public enum TestStatus {
    PASS, FAIL, SKIP
}
