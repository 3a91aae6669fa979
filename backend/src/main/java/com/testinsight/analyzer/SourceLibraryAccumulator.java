package com.testinsight.analyzer;

import com.testinsight.source.SourceBrowser;

import java.util.*;

/**
 * Library import usage across the repository's suite and resource files.
 */
public class SourceLibraryAccumulator implements KpiAccumulator<SourceLibraryAccumulator.Result> {

    private static final int LISTED_FILES = 10;

    public record LibraryUsage(String library, int fileCount, double percentage, List<String> files) {}

    public record Result(int totalLibraries, int filesWithImports, List<LibraryUsage> libraries) {}

    private final SourceBrowser sourceBrowser;
    private final UUID repositoryId;
    private final KeywordLibraryResolver resolver;

    public SourceLibraryAccumulator(SourceBrowser sourceBrowser, UUID repositoryId, KeywordLibraryResolver resolver) {
        this.sourceBrowser = sourceBrowser;
        this.repositoryId = repositoryId;
        this.resolver = resolver;
    }

    @Override
    public void fold(ReportData report) {
        // source-based: nothing to fold
    }

    @Override
    public Result finish() {
        Map<String, Set<String>> imports = repositoryId != null
                ? sourceBrowser.listLibraryImports(repositoryId)
                : Map.of();

        Map<String, TreeSet<String>> filesByLibrary = new HashMap<>();
        imports.forEach((file, libraries) -> libraries.forEach(library ->
                filesByLibrary.computeIfAbsent(resolver.canonicalLibrary(library), k -> new TreeSet<>()).add(file)));

        int filesWithImports = (int) imports.values().stream().filter(libs -> !libs.isEmpty()).count();
        List<LibraryUsage> usages = filesByLibrary.entrySet().stream()
                .map(e -> new LibraryUsage(e.getKey(), e.getValue().size(),
                        Rounding.percentage(e.getValue().size(), filesWithImports),
                        e.getValue().stream().limit(LISTED_FILES).toList()))
                .sorted(Comparator.comparingInt(LibraryUsage::fileCount).reversed()
                        .thenComparing(LibraryUsage::library))
                .toList();
        return new Result(usages.size(), filesWithImports, usages);
    }
}
