package com.channelcatalog.verifier;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Pass-level settings for a verification or generation run. Nothing here is persisted.
 * <p>
 * Each option is read from the command line first, then from an environment variable, then from a
 * system property of the same name, then falls back to its default:
 * <ul>
 *   <li>{@code -t, --timeout <ms>} / {@code CATALOG_TIMEOUT} (5000)</li>
 *   <li>{@code -d, --delay <ms>} / {@code CATALOG_DELAY} (0)</li>
 *   <li>{@code --offline} / {@code CATALOG_OFFLINE}: no probing, no reference feeds</li>
 *   <li>{@code --debug} / {@code CATALOG_DEBUG}: log every failed probe</li>
 *   <li>{@code -c, --country <cc,...>} / {@code CATALOG_COUNTRY}</li>
 *   <li>{@code -e, --exclude <cc,...>} / {@code CATALOG_EXCLUDE}</li>
 *   <li>{@code --input <dir>} / {@code CATALOG_INPUT} ({@code channels})</li>
 *   <li>{@code --output <dir>} / {@code CATALOG_OUTPUT} ({@code .gh-pages})</li>
 *   <li>{@code --channels-feed <url>}, {@code --codes-feed <url>}</li>
 * </ul>
 */
public record CatalogConfig(
    int timeoutMs,
    int delayMs,
    boolean offline,
    boolean debug,
    List<String> includeCountries,
    List<String> excludeCountries,
    Path inputDir,
    Path outputDir,
    String channelsFeed,
    String codesFeed
) {
    public static final int DEFAULT_TIMEOUT_MS = 5000;

    public CatalogConfig {
        if (timeoutMs <= 0) throw new IllegalArgumentException("Timeout must be positive: " + timeoutMs);
        if (delayMs < 0) throw new IllegalArgumentException("Delay cannot be negative: " + delayMs);
        includeCountries = includeCountries == null ? List.of() : List.copyOf(includeCountries);
        excludeCountries = excludeCountries == null ? List.of() : List.copyOf(excludeCountries);
        inputDir = inputDir == null ? Paths.get("channels") : inputDir;
        outputDir = outputDir == null ? Paths.get(".gh-pages") : outputDir;
        channelsFeed = channelsFeed == null ? ReferenceDataClient.DEFAULT_CHANNELS_FEED : channelsFeed;
        codesFeed = codesFeed == null ? ReferenceDataClient.DEFAULT_CODES_FEED : codesFeed;
    }

    public static CatalogConfig defaults() {
        return fromArgs(new String[0]);
    }

    /**
     * Builds a configuration from command-line options with environment / system property fallback.
     * @param args options (the mode argument already removed)
     * @return configuration
     * @throws IllegalArgumentException on unknown options, missing values or non-numeric numbers
     */
    public static CatalogConfig fromArgs(String[] args) {
        String timeout = envOrProp("CATALOG_TIMEOUT", String.valueOf(DEFAULT_TIMEOUT_MS));
        String delay = envOrProp("CATALOG_DELAY", "0");
        boolean offline = Boolean.parseBoolean(envOrProp("CATALOG_OFFLINE", "false"));
        boolean debug = Boolean.parseBoolean(envOrProp("CATALOG_DEBUG", "false"));
        String country = envOrProp("CATALOG_COUNTRY", "");
        String exclude = envOrProp("CATALOG_EXCLUDE", "");
        String input = envOrProp("CATALOG_INPUT", "channels");
        String output = envOrProp("CATALOG_OUTPUT", ".gh-pages");
        String channelsFeed = envOrProp("CATALOG_CHANNELS_FEED", ReferenceDataClient.DEFAULT_CHANNELS_FEED);
        String codesFeed = envOrProp("CATALOG_CODES_FEED", ReferenceDataClient.DEFAULT_CODES_FEED);

        String[] a = args == null ? new String[0] : args;
        for (int i = 0; i < a.length; i++) {
            String arg = a[i];
            switch (arg) {
                case "--offline" -> offline = true;
                case "--debug" -> debug = true;
                case "-t", "--timeout" -> timeout = value(a, ++i, arg);
                case "-d", "--delay" -> delay = value(a, ++i, arg);
                case "-c", "--country" -> country = value(a, ++i, arg);
                case "-e", "--exclude" -> exclude = value(a, ++i, arg);
                case "--input" -> input = value(a, ++i, arg);
                case "--output" -> output = value(a, ++i, arg);
                case "--channels-feed" -> channelsFeed = value(a, ++i, arg);
                case "--codes-feed" -> codesFeed = value(a, ++i, arg);
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        return new CatalogConfig(
            parseNumber(timeout, "timeout"),
            parseNumber(delay, "delay"),
            offline,
            debug,
            splitCodes(country),
            splitCodes(exclude),
            Paths.get(input),
            Paths.get(output),
            channelsFeed,
            codesFeed
        );
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) throw new IllegalArgumentException("Missing value for " + option);
        return args[index];
    }

    private static int parseNumber(String s, String option) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + option + ": " + s, e);
        }
    }

    /**
     * Splits a comma-separated list of country codes, dropping blanks and lower-casing the rest.
     */
    static List<String> splitCodes(String s) {
        if (s == null) return List.of();
        return Arrays.stream(s.split(","))
            .map(String::trim)
            .filter(c -> !c.isEmpty())
            .map(String::toLowerCase)
            .collect(Collectors.toList());
    }

    private static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null) return ev;
        String prop = System.getProperty(key);
        return prop != null ? prop : defaultVal;
    }
}
