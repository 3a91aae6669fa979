package com.testinsight.analyzer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.testinsight.model.KeywordCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Maps well-known keyword names to the library that owns them.
 *
 * <p>Lookup is case-insensitive on the full keyword name. A leading {@code Library.} qualifier is
 * honoured when it names a catalogued library. The table is loaded once and never changes.
 */
@Component
@Slf4j
public class KeywordLibraryResolver {

    public static final String UNKNOWN = "Unknown";

    static final String CATALOG_RESOURCE = "keyword-libraries.json";

    private final Map<String, String> keywordToLibrary;
    private final Map<String, String> libraryNames;

    public KeywordLibraryResolver(ObjectMapper objectMapper) {
        Map<String, List<String>> catalog = loadCatalog(objectMapper);
        Map<String, String> keywords = new HashMap<>();
        Map<String, String> libraries = new HashMap<>();
        // First library to claim a keyword wins; BuiltIn is listed first.
        catalog.forEach((library, names) -> {
            libraries.put(library.toLowerCase(Locale.ROOT), library);
            for (String name : names) {
                keywords.putIfAbsent(name.trim().toLowerCase(Locale.ROOT), library);
            }
        });
        this.keywordToLibrary = Collections.unmodifiableMap(keywords);
        this.libraryNames = Collections.unmodifiableMap(libraries);
        log.info("Loaded {} keywords across {} libraries", keywordToLibrary.size(), libraryNames.size());
    }

    public String resolveLibrary(String keywordName) {
        if (keywordName == null || keywordName.isBlank()) return UNKNOWN;
        String trimmed = keywordName.trim();
        String library = keywordToLibrary.get(trimmed.toLowerCase(Locale.ROOT));
        if (library != null) return library;

        String qualifier = qualifierOf(trimmed);
        if (qualifier != null) {
            String qualified = libraryNames.get(qualifier.toLowerCase(Locale.ROOT));
            if (qualified != null) return qualified;
        }
        return UNKNOWN;
    }

    /** The recorded library of a call, falling back to the catalog when the report omitted it. */
    public String libraryOf(KeywordCall call) {
        String recorded = call.getLibraryName();
        if (recorded != null && !recorded.isBlank()) return recorded.trim();
        return resolveLibrary(call.getKeywordName());
    }

    /** Keyword name without a {@code Library.} qualifier, when the qualifier names a known library. */
    public String canonicalName(String keywordName) {
        if (keywordName == null) return "";
        String trimmed = keywordName.trim();
        String qualifier = qualifierOf(trimmed);
        if (qualifier != null && libraryNames.containsKey(qualifier.toLowerCase(Locale.ROOT))) {
            return trimmed.substring(qualifier.length() + 1).trim();
        }
        return trimmed;
    }

    /**
     * Normalizes a {@code Library} import to a library name: path imports reduce to their file stem and
     * catalogued libraries take their canonical spelling.
     */
    public String canonicalLibrary(String importName) {
        if (importName == null || importName.isBlank()) return UNKNOWN;
        String name = importName.trim().replace('\\', '/');
        int slash = name.lastIndexOf('/');
        if (slash >= 0) name = name.substring(slash + 1);
        if (name.toLowerCase(Locale.ROOT).endsWith(".py")) name = name.substring(0, name.length() - 3);
        if (name.isBlank()) return UNKNOWN;
        return libraryNames.getOrDefault(name.toLowerCase(Locale.ROOT), name);
    }

    public int size() {
        return keywordToLibrary.size();
    }

    private static String qualifierOf(String keywordName) {
        int dot = keywordName.indexOf('.');
        if (dot <= 0 || dot == keywordName.length() - 1) return null;
        return keywordName.substring(0, dot);
    }

    private static Map<String, List<String>> loadCatalog(ObjectMapper objectMapper) {
        try (InputStream in = new ClassPathResource(CATALOG_RESOURCE).getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<LinkedHashMap<String, List<String>>>() {});
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load keyword catalog " + CATALOG_RESOURCE, e);
        }
    }
}
