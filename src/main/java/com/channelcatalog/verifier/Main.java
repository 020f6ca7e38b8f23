package com.channelcatalog.verifier;

import com.channelcatalog.generator.Catalog;
import com.channelcatalog.generator.IndexGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;

/**
 * Main entry point for the channel catalog.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@code verify} (default): probe, classify, enrich and canonicalize the source playlists in place.</li>
 *   <li>{@code generate}: load all source playlists and regenerate the output playlists and JSON snapshot.</li>
 * </ul>
 * Options after the mode are described in {@link CatalogConfig}.
 *
 * @author Channel Catalog Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    /**
     * Runs the verification pass.
     * @param config run configuration
     */
    static void verify(CatalogConfig config) throws InterruptedException {
        logger.info("Starting verification (timeout={}ms, delay={}ms, offline={}, debug={})...",
            config.timeoutMs(), config.delayMs(), config.offline(), config.debug());
        PlaylistStoreInterface store = new PlaylistStore(config.inputDir());
        StreamProberInterface prober = config.offline()
            ? null
            : new HttpStreamProber(new FfprobeMediaInspector(), Duration.ofMillis(config.timeoutMs()));
        ReferenceDataClient referenceClient = new ReferenceDataClient(Duration.ofMillis(Math.max(config.timeoutMs(), 30_000)));
        var summaries = new CatalogVerifier(config, store, prober, referenceClient).run();
        long updated = summaries.stream().filter(VerificationSummary::updated).count();
        logger.info("Done. {} playlists processed, {} updated.", summaries.size(), updated);
    }

    /**
     * Regenerates the outputs from the source playlists.
     * @param config run configuration
     */
    static void generate(CatalogConfig config) throws IOException {
        logger.info("Loading database...");
        Catalog catalog = Catalog.load(new PlaylistStore(config.inputDir()), new M3uPlaylistCodec());
        logger.info("Creating {} folder...", config.outputDir());
        new IndexGenerator(config.outputDir()).generate(catalog);
    }

    /**
     * Main application entry point.
     * @param args mode followed by options
     */
    public static void main(String[] args) {
        String[] a = args == null ? new String[0] : args;
        String mode = a.length > 0 && !a[0].startsWith("-") ? a[0].trim().toLowerCase() : "verify";
        String[] options = a.length > 0 && !a[0].startsWith("-") ? Arrays.copyOfRange(a, 1, a.length) : a;

        CatalogConfig config;
        try {
            config = CatalogConfig.fromArgs(options);
        } catch (IllegalArgumentException e) {
            logger.error("{}", e.getMessage());
            logger.info("Usage: [verify|generate] [--debug] [--offline] [-t ms] [-d ms] [-c cc,..] [-e cc,..] [--input dir] [--output dir]");
            System.exit(2);
            return;
        }

        try {
            switch (mode) {
                case "verify" -> verify(config);
                case "generate" -> generate(config);
                default -> {
                    logger.error("Unknown mode '{}'. Expected 'verify' or 'generate'.", mode);
                    System.exit(2);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Run cancelled.");
            System.exit(130);
        } catch (Exception e) {
            logger.error("Fatal error: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
