package com.testinsight.source;

import java.util.List;

public record SourceTestFile(String path, String suiteName, List<SourceTestCase> tests) {

    public SourceTestFile {
        tests = List.copyOf(tests);
    }
}
