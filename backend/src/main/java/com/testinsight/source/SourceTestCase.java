package com.testinsight.source;

import java.util.List;

public record SourceTestCase(String name, int lineCount, List<String> steps, List<String> tags) {

    public SourceTestCase {
        steps = List.copyOf(steps);
        tags = List.copyOf(tags);
    }
}
