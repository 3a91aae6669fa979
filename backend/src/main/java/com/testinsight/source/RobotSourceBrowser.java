package com.testinsight.source;

import com.testinsight.config.AnalyticsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Parses Robot Framework suite files from the configured checkout of a repository.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RobotSourceBrowser implements SourceBrowser {

    private static final Set<String> IGNORED_DIRS = Set.of(
            ".git", "__pycache__", ".venv", "node_modules", ".tox", ".pytest_cache", ".mypy_cache");
    private static final Pattern CELL_SEPARATOR = Pattern.compile(" {2,}|\t+");

    private final AnalyticsProperties properties;

    @Override
    public List<SourceTestFile> listTestFiles(UUID repositoryId) {
        Optional<Path> root = resolveRoot(repositoryId);
        if (root.isEmpty()) return List.of();

        List<SourceTestFile> files = new ArrayList<>();
        for (Path file : findFiles(root.get(), Set.of(".robot"))) {
            readLines(file).ifPresent(lines -> {
                List<SourceTestCase> tests = parseTestCases(lines);
                if (!tests.isEmpty()) {
                    files.add(new SourceTestFile(relativePath(root.get(), file), suiteName(file), tests));
                }
            });
        }
        return files;
    }

    @Override
    public Map<String, Set<String>> listLibraryImports(UUID repositoryId) {
        Optional<Path> root = resolveRoot(repositoryId);
        if (root.isEmpty()) return Map.of();

        Map<String, Set<String>> imports = new TreeMap<>();
        for (Path file : findFiles(root.get(), Set.of(".robot", ".resource"))) {
            readLines(file).ifPresent(lines -> {
                Set<String> libraries = parseLibraryImports(lines);
                if (!libraries.isEmpty()) {
                    imports.put(relativePath(root.get(), file), libraries);
                }
            });
        }
        return imports;
    }

    // ── Parsing ─────────────────────────────────────────────────────────

    static List<SourceTestCase> parseTestCases(List<String> lines) {
        List<SourceTestCase> tests = new ArrayList<>();
        boolean inTestSection = false;
        TestCaseBuilder current = null;

        for (int i = 0; i < lines.size(); i++) {
            int lineNo = i + 1;
            String line = lines.get(i);
            String stripped = line.strip();

            if (stripped.startsWith("***")) {
                if (current != null) {
                    tests.add(current.build(lineNo - 1));
                    current = null;
                }
                inTestSection = stripped.toLowerCase(Locale.ROOT).startsWith("*** test case");
                continue;
            }
            if (!inTestSection || stripped.isEmpty()) continue;

            boolean indented = line.startsWith(" ") || line.startsWith("\t");
            if (!indented) {
                if (stripped.startsWith("#")) continue;
                if (current != null) tests.add(current.build(lineNo - 1));
                current = new TestCaseBuilder(stripped, lineNo);
                continue;
            }
            if (current == null || stripped.startsWith("#")) continue;

            String lower = stripped.toLowerCase(Locale.ROOT);
            if (lower.startsWith("[tags]")) {
                current.tags.addAll(cells(stripped.substring("[tags]".length())));
            } else if (!lower.startsWith("[")) {
                List<String> cells = cells(stripped);
                if (!cells.isEmpty()) current.steps.add(cells.get(0));
            }
        }
        if (current != null) tests.add(current.build(lines.size()));
        return tests;
    }

    static Set<String> parseLibraryImports(List<String> lines) {
        Set<String> libraries = new TreeSet<>();
        boolean inSettings = false;
        for (String line : lines) {
            String stripped = line.strip();
            if (stripped.startsWith("***")) {
                inSettings = stripped.toLowerCase(Locale.ROOT).startsWith("*** setting");
                continue;
            }
            if (!inSettings || stripped.isEmpty() || stripped.startsWith("#")) continue;
            List<String> cells = cells(stripped);
            if (cells.size() > 1 && cells.get(0).equalsIgnoreCase("library")) {
                libraries.add(cells.get(1));
            }
        }
        return libraries;
    }

    private static List<String> cells(String text) {
        return Arrays.stream(CELL_SEPARATOR.split(text.strip()))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static final class TestCaseBuilder {
        private final String name;
        private final int startLine;
        private final List<String> steps = new ArrayList<>();
        private final List<String> tags = new ArrayList<>();

        private TestCaseBuilder(String name, int startLine) {
            this.name = name;
            this.startLine = startLine;
        }

        private SourceTestCase build(int endLine) {
            return new SourceTestCase(name, Math.max(1, endLine - startLine + 1), steps, tags);
        }
    }

    // ── File access ─────────────────────────────────────────────────────

    private Optional<Path> resolveRoot(UUID repositoryId) {
        if (repositoryId == null) return Optional.empty();
        String configured = properties.getSource().getRepositories().get(repositoryId);
        if (configured == null || configured.isBlank()) {
            log.debug("No source checkout configured for repository {}", repositoryId);
            return Optional.empty();
        }
        Path root = Paths.get(configured);
        if (!Files.isDirectory(root)) {
            log.warn("Source checkout for repository {} is not a directory: {}", repositoryId, root);
            return Optional.empty();
        }
        return Optional.of(root);
    }

    private List<Path> findFiles(Path root, Set<String> extensions) {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> !isIgnored(root.relativize(p)))
                    .filter(p -> extensions.stream().anyMatch(ext ->
                            p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(ext)))
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to scan sources under {}: {}", root, e.getMessage());
            return List.of();
        }
    }

    private static boolean isIgnored(Path relative) {
        for (Path part : relative) {
            if (IGNORED_DIRS.contains(part.toString())) return true;
        }
        return false;
    }

    private static Optional<List<String>> readLines(Path file) {
        try {
            // Invalid bytes decode to U+FFFD instead of failing the whole file.
            return Optional.of(new String(Files.readAllBytes(file), StandardCharsets.UTF_8).lines().toList());
        } catch (IOException e) {
            log.warn("Skipping unreadable source file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private static String relativePath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static String suiteName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
