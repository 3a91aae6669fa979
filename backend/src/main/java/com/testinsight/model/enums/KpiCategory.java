package com.testinsight.model.enums;

public enum KpiCategory {
    KEYWORDS, QUALITY, MAINTENANCE, SOURCE, EXECUTION
}
