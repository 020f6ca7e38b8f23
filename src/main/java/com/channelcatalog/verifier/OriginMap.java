package com.channelcatalog.verifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Protocol-stripped stream URL to the channel URL that first claimed it as an origin.
 * Owned by a single playlist pass; the first registration of a key wins.
 */
public class OriginMap {
    private final Map<String, String> origins = new LinkedHashMap<>();

    /**
     * Registers a key unless it is already claimed.
     * @return true if the key was newly registered
     */
    public boolean claim(String strippedUrl, String canonicalUrl) {
        return origins.putIfAbsent(strippedUrl, canonicalUrl) == null;
    }

    public String lookup(String strippedUrl) {
        return origins.get(strippedUrl);
    }

    public int size() {
        return origins.size();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(origins);
    }
}
