package com.channelcatalog.verifier;

import java.nio.file.Path;

/**
 * Counters of one playlist pass.
 *
 * @param playlist source file
 * @param total channels in the playlist
 * @param probed channels that were sent to the prober
 * @param online probes classified online
 * @param failed probes that failed or could not complete
 * @param skipped channels not probed (offline mode or sentinel status)
 * @param rewritten channel URLs rewritten to a canonical origin
 * @param errors channels whose processing raised an unexpected error
 * @param updated whether the serialized playlist changed
 */
public record VerificationSummary(
    Path playlist,
    int total,
    int probed,
    int online,
    int failed,
    int skipped,
    int rewritten,
    int errors,
    boolean updated
) {
    public VerificationSummary withUpdated(boolean updated) {
        return new VerificationSummary(playlist, total, probed, online, failed, skipped, rewritten, errors, updated);
    }
}
