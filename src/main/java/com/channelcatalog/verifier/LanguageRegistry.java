package com.channelcatalog.verifier;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Registry of language names used in {@code tvg-language} attributes, keyed by name.
 * Loaded once from the bundled {@code languages.csv} ({@code code,name}).
 */
public final class LanguageRegistry {
    private static final Logger logger = LoggerFactory.getLogger(LanguageRegistry.class);
    private static final String RESOURCE = "/languages.csv";

    private static final Map<String, Language> BY_NAME = new LinkedHashMap<>();

    static {
        try (InputStream in = LanguageRegistry.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.error("Language table {} is missing from the classpath.", RESOURCE);
            } else {
                try (CSVReader reader = new CSVReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                    List<String[]> rows = reader.readAll();
                    for (String[] row : rows.subList(Math.min(1, rows.size()), rows.size())) {
                        if (row.length < 2 || row[1].isBlank()) continue;
                        Language language = new Language(row[0].trim(), row[1].trim());
                        BY_NAME.put(language.name().toLowerCase(), language);
                    }
                }
            }
        } catch (IOException | CsvException e) {
            logger.error("Failed to load language table {}: {}", RESOURCE, e.getMessage());
        }
    }

    private LanguageRegistry() {}

    /**
     * Returns the language with the given display name (case-insensitive), or null.
     */
    public static Language byName(String name) {
        if (name == null) return null;
        return BY_NAME.get(name.trim().toLowerCase());
    }

    /**
     * Resolves a {@code ;}-separated list of language names. Unknown names are skipped.
     * @param names value of a tvg-language attribute
     * @return known languages in declaration order, never null
     */
    public static List<Language> fromNames(String names) {
        List<Language> out = new ArrayList<>();
        if (names == null || names.isBlank()) return out;
        for (String name : names.split(";")) {
            Language language = byName(name);
            if (language != null && !out.contains(language)) out.add(language);
        }
        return out;
    }
}
