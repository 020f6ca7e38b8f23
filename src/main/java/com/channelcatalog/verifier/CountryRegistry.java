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
 * Central registry of known countries and their default broadcast language.
 * Loaded once from the bundled {@code countries.csv} ({@code code,name,language}).
 */
public final class CountryRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CountryRegistry.class);
    private static final String RESOURCE = "/countries.csv";

    private static final Map<String, Country> COUNTRIES = new LinkedHashMap<>();
    private static final Map<String, String> DEFAULT_LANGUAGES = new HashMap<>();

    static {
        load();
    }

    private CountryRegistry() {}

    private static void load() {
        try (InputStream in = CountryRegistry.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.error("Country table {} is missing from the classpath.", RESOURCE);
                return;
            }
            try (CSVReader reader = new CSVReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                List<String[]> rows = reader.readAll();
                for (String[] row : rows.subList(Math.min(1, rows.size()), rows.size())) {
                    if (row.length < 2 || row[0].isBlank()) continue;
                    String code = row[0].trim().toLowerCase();
                    COUNTRIES.put(code, new Country(code, row[1].trim()));
                    if (row.length > 2 && !row[2].isBlank()) DEFAULT_LANGUAGES.put(code, row[2].trim());
                }
            }
            logger.debug("Loaded {} countries from {}", COUNTRIES.size(), RESOURCE);
        } catch (IOException | CsvException e) {
            logger.error("Failed to load country table {}: {}", RESOURCE, e.getMessage());
        }
    }

    /**
     * Returns the country for a code (case-insensitive), or null if unknown.
     */
    public static Country byCode(String code) {
        if (code == null) return null;
        return COUNTRIES.get(code.trim().toLowerCase());
    }

    /**
     * Returns the display name for a country code, or null if unknown.
     */
    public static String codeToName(String code) {
        Country country = byCode(code);
        return country == null ? null : country.name();
    }

    /**
     * Returns the default language name of a country, or an empty string if unknown.
     */
    public static String countryToLanguage(String code) {
        if (code == null) return "";
        return DEFAULT_LANGUAGES.getOrDefault(code.trim().toLowerCase(), "");
    }

    public static Collection<Country> all() {
        return Collections.unmodifiableCollection(COUNTRIES.values());
    }
}
