package com.channelcatalog.verifier;

import java.io.IOException;
import java.util.List;

/**
 * Reads the elementary streams of a reachable media URL.
 */
public interface MediaInspectorInterface {
    /**
     * @param url reachable media URL
     * @param timeoutMs upper bound for the inspection in milliseconds
     * @return stream descriptors, empty if nothing could be read
     * @throws IOException if the inspector could not be started
     * @throws InterruptedException if the calling thread was interrupted
     */
    List<MediaStream> inspect(String url, int timeoutMs) throws IOException, InterruptedException;
}
