package com.testinsight.source;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Read access to the current test-suite sources of a repository.
 */
public interface SourceBrowser {

    List<SourceTestFile> listTestFiles(UUID repositoryId);

    /** Relative file path to the libraries it imports. */
    Map<String, Set<String>> listLibraryImports(UUID repositoryId);
}
