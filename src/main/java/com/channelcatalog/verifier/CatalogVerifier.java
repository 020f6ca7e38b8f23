package com.channelcatalog.verifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a verification pass over every selected source playlist.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Select playlists from the store by the include / exclude country filters.</li>
 *   <li>Load reference data once, unless running offline.</li>
 *   <li>For each playlist: read, parse, run the {@link VerificationPipeline}, and write it back only if
 *       its text changed.</li>
 * </ul>
 * A playlist that cannot be read or written is logged and skipped; the run goes on with the next one.
 *
 * @author Channel Catalog Team
 * @since 1.0
 */
public class CatalogVerifier {
    private static final Logger logger = LoggerFactory.getLogger(CatalogVerifier.class);

    private final CatalogConfig config;
    private final PlaylistStoreInterface store;
    private final ReferenceDataClient referenceClient;
    private final VerificationPipeline pipeline;
    private final M3uPlaylistCodec codec = new M3uPlaylistCodec();

    public CatalogVerifier(CatalogConfig config, PlaylistStoreInterface store, StreamProberInterface prober,
                           ReferenceDataClient referenceClient) {
        if (config == null || store == null) throw new IllegalArgumentException("Config and store are required");
        this.config = config;
        this.store = store;
        this.referenceClient = referenceClient;
        this.pipeline = new VerificationPipeline(prober, config);
    }

    /**
     * Verifies all selected playlists.
     * @return one summary per processed playlist; empty when nothing was selected
     * @throws InterruptedException if the run was interrupted
     */
    public List<VerificationSummary> run() throws InterruptedException {
        List<VerificationSummary> summaries = new ArrayList<>();
        List<Path> files;
        try {
            files = store.list(config.includeCountries(), config.excludeCountries());
        } catch (IOException e) {
            logger.error("Failed to list playlists in '{}': {}", config.inputDir(), e.getMessage());
            return summaries;
        }
        if (files.isEmpty()) {
            logger.info("No files is selected");
            return summaries;
        }

        ReferenceData reference = ReferenceData.empty();
        if (!config.offline() && referenceClient != null) {
            reference = referenceClient.load(config.channelsFeed(), config.codesFeed());
        }

        for (Path file : files) {
            logger.info("Processing '{}'...", file);
            try {
                String original = store.read(file);
                Playlist playlist = codec.parse(original, file, store.countryCodeOf(file));
                VerificationSummary summary = pipeline.process(playlist, reference);
                String updated = playlist.toM3u();
                boolean changed = !original.equals(updated);
                if (changed) {
                    store.write(file, updated);
                    logger.info("File '{}' has been updated", file);
                }
                summary = summary.withUpdated(changed);
                logger.info("  {} channels: {} probed, {} online, {} failed, {} skipped, {} rewritten, {} errors",
                    summary.total(), summary.probed(), summary.online(), summary.failed(), summary.skipped(),
                    summary.rewritten(), summary.errors());
                summaries.add(summary);
            } catch (IOException e) {
                logger.error("Failed to update playlist '{}': {}", file, e.getMessage());
            }
        }
        return summaries;
    }
}
