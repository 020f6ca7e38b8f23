package com.channelcatalog.verifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Verifies and canonicalizes the channels of one playlist.
 * <p>
 * Workflow (channels strictly in source order, one at a time):
 * <ul>
 *   <li>Normalize the stream URL.</li>
 *   <li>Unless offline mode is on or the channel carries a sentinel status, probe it (with the configured
 *       delay between probes), classify the result and apply it to the stored status and resolution.</li>
 *   <li>Enrich empty metadata from the reference data.</li>
 *   <li>Let successful origin probes claim their request chain in the pass's {@link OriginMap}.</li>
 *   <li>Once every channel is done, rewrite each successfully probed channel to its canonical origin.</li>
 * </ul>
 * Error Handling:
 * <ul>
 *   <li>Transport errors from the prober count as an offline classification and never abort the pass.</li>
 *   <li>Unexpected runtime errors are contained per channel; the remaining channels are still processed.</li>
 *   <li>Interruption cancels the whole pass.</li>
 * </ul>
 *
 * @author Channel Catalog Team
 * @since 1.0
 */
public class VerificationPipeline {
    private static final Logger logger = LoggerFactory.getLogger(VerificationPipeline.class);

    private final StreamProberInterface prober;
    private final MetadataEnricher enricher;
    private final StatusClassifier classifier;
    private final OriginCanonicalizer canonicalizer;
    private final int timeoutMs;
    private final int delayMs;
    private final boolean offline;
    private final boolean debug;

    public VerificationPipeline(StreamProberInterface prober, MetadataEnricher enricher, StatusClassifier classifier,
                                OriginCanonicalizer canonicalizer, int timeoutMs, int delayMs, boolean offline, boolean debug) {
        if (prober == null && !offline) throw new IllegalArgumentException("A prober is required unless running offline");
        this.prober = prober;
        this.enricher = enricher == null ? new MetadataEnricher() : enricher;
        this.classifier = classifier == null ? new StatusClassifier() : classifier;
        this.canonicalizer = canonicalizer == null ? new OriginCanonicalizer() : canonicalizer;
        this.timeoutMs = timeoutMs;
        this.delayMs = delayMs;
        this.offline = offline;
        this.debug = debug;
    }

    public VerificationPipeline(StreamProberInterface prober, CatalogConfig config) {
        this(prober, new MetadataEnricher(), new StatusClassifier(), new OriginCanonicalizer(),
            config.timeoutMs(), config.delayMs(), config.offline(), config.debug());
    }

    /**
     * Runs one pass over a playlist, updating its channels in place.
     * @param playlist playlist to verify
     * @param reference reference data for enrichment
     * @return counters of the pass
     * @throws InterruptedException if interrupted while probing or waiting between probes
     */
    public VerificationSummary process(Playlist playlist, ReferenceData reference) throws InterruptedException {
        ReferenceData ref = reference == null ? ReferenceData.empty() : reference;
        Map<Channel, ProbeResult> onlineResults = new IdentityHashMap<>();
        OriginMap origins = new OriginMap();
        int probed = 0, online = 0, failed = 0, skipped = 0, rewritten = 0, errors = 0;

        for (Channel channel : playlist.channels()) {
            try {
                channel.setUrl(Utils.normalizeUrl(channel.getUrl()));

                ProbeResult result = null;
                if (offline || ChannelStatus.isSentinel(channel.getStatus())) {
                    skipped++;
                } else {
                    if (probed > 0 && delayMs > 0) Thread.sleep(delayMs);
                    probed++;
                    result = probe(channel);
                    if (result != null && result.ok()) online++; else failed++;
                }

                enricher.enrich(channel, playlist.countryCode(), ref);

                if (result != null && result.ok()) {
                    onlineResults.put(channel, result);
                    canonicalizer.register(channel.getUrl(), result.requestChain(), origins);
                }
            } catch (RuntimeException e) {
                errors++;
                logger.error("Failed to process channel '{}' ({}): {}", channel.getName(), channel.getUrl(), e.getMessage());
            }
        }

        for (Channel channel : playlist.channels()) {
            ProbeResult result = onlineResults.get(channel);
            if (result == null) continue;
            try {
                if (canonicalizer.canonicalize(channel, result.requestChain(), origins)) rewritten++;
            } catch (RuntimeException e) {
                errors++;
                logger.error("Failed to canonicalize channel '{}' ({}): {}", channel.getName(), channel.getUrl(), e.getMessage());
            }
        }

        logger.debug("Origin map for '{}' holds {} entries.", playlist.source(), origins.size());
        return new VerificationSummary(playlist.source(), playlist.channels().size(), probed, online, failed, skipped, rewritten, errors, false);
    }

    /**
     * Probes one channel and applies the classification.
     * @return the probe result, or null if the probe could not complete
     */
    private ProbeResult probe(Channel channel) throws InterruptedException {
        ProbeResult result;
        try {
            result = prober.probe(channel.getUrl(), timeoutMs);
        } catch (IOException e) {
            classifier.updateStatus(channel, ProbeStatus.OFFLINE);
            diagnostic("  ERR: {} ({})", channel.getUrl(), e.getMessage());
            return null;
        }

        ProbeStatus status = classifier.classify(result);
        classifier.updateStatus(channel, status);
        if (status == ProbeStatus.ONLINE) {
            classifier.updateResolution(channel, classifier.resolutionOf(result.streams()));
        } else {
            diagnostic("  INFO: {} ({})", channel.getUrl(), result == null ? "no result" : result.reasonText());
        }
        return result;
    }

    private void diagnostic(String format, String url, String reason) {
        if (debug) {
            logger.info(format, url, reason);
        } else {
            logger.debug(format, url, reason);
        }
    }
}
