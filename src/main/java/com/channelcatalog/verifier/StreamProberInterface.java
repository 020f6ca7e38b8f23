package com.channelcatalog.verifier;

import java.io.IOException;

/**
 * Capability that checks whether a stream URL answers.
 * <p>
 * Implementations report structured failures (HTTP errors, time-outs) as a failed
 * {@link ProbeResult} and reserve {@link IOException} for transport errors where no answer was
 * obtained at all.
 */
public interface StreamProberInterface {
    /**
     * Probes a stream.
     * @param url stream URL
     * @param timeoutMs per-request timeout in milliseconds
     * @return structured result
     * @throws IOException if the probe could not complete
     * @throws InterruptedException if the calling thread was interrupted
     */
    ProbeResult probe(String url, int timeoutMs) throws IOException, InterruptedException;
}
