package com.testinsight.analyzer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.testinsight.source.SourceBrowser;
import com.testinsight.source.SourceTestCase;
import com.testinsight.source.SourceTestFile;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SourceAccumulatorTest {

    private static KeywordLibraryResolver resolver;
    private final UUID repositoryId = UUID.randomUUID();

    @Mock
    private SourceBrowser sourceBrowser;

    @BeforeAll
    static void loadCatalog() {
        resolver = new KeywordLibraryResolver(new ObjectMapper());
    }

    @Test
    void sourceTestStats_SummarizesFiles() {
        when(sourceBrowser.listTestFiles(repositoryId)).thenReturn(List.of(
                new SourceTestFile("a.robot", "a", List.of(
                        new SourceTestCase("T1", 4, List.of("Open Browser", "Log"), List.of()),
                        new SourceTestCase("T2", 8, List.of("Log", "Log", "Custom", "Custom", "Custom", "Custom"), List.of()))),
                new SourceTestFile("b.robot", "b", List.of(
                        new SourceTestCase("T3", 6, List.of("Log"), List.of())))));

        SourceTestStatsAccumulator.Result result = new SourceTestStatsAccumulator(
                sourceBrowser, repositoryId, resolver, List.of(5, 10, 20, 50), 50).finish();

        assertEquals(2, result.totalFiles());
        assertEquals(3, result.totalTests());
        assertEquals(6.0, result.avgLines());
        assertEquals(4, result.minLines());
        assertEquals(8, result.maxLines());
        assertEquals(1, result.minSteps());
        assertEquals(6, result.maxSteps());
        assertEquals("Custom", result.topKeywords().get(0).name());
        assertEquals("Unknown", result.topKeywords().get(0).library());
        assertEquals("BuiltIn", result.topKeywords().get(1).library());
        assertEquals("a.robot", result.files().get(0).path());
        assertEquals(2, result.files().get(0).testCount());
    }

    @Test
    void sourceTestStats_WithoutRepository_IsEmpty() {
        SourceTestStatsAccumulator.Result result = new SourceTestStatsAccumulator(
                sourceBrowser, null, resolver, List.of(5, 10), 50).finish();

        assertEquals(0, result.totalTests());
        verifyNoInteractions(sourceBrowser);
    }

    @Test
    void sourceLibraries_CountsFilesPerCanonicalLibrary() {
        when(sourceBrowser.listLibraryImports(repositoryId)).thenReturn(Map.of(
                "a.robot", Set.of("SeleniumLibrary", "libs/helpers.py"),
                "b.robot", Set.of("seleniumlibrary"),
                "c.resource", Set.of("Collections")));

        SourceLibraryAccumulator.Result result =
                new SourceLibraryAccumulator(sourceBrowser, repositoryId, resolver).finish();

        assertEquals(3, result.filesWithImports());
        assertEquals(3, result.totalLibraries());
        SourceLibraryAccumulator.LibraryUsage selenium = result.libraries().get(0);
        assertEquals("SeleniumLibrary", selenium.library());
        assertEquals(2, selenium.fileCount());
        assertEquals(66.7, selenium.percentage());
        assertEquals(List.of("a.robot", "b.robot"), selenium.files());
        assertTrue(result.libraries().stream().anyMatch(l -> l.library().equals("helpers")));
    }
}
