package com.channelcatalog.verifier;

import java.util.Map;

/**
 * Reference maps used for enrichment during one run, both keyed by tvg-id.
 */
public record ReferenceData(Map<String, ReferenceChannel> channels, Map<String, EpgCode> codes) {

    public ReferenceData {
        channels = channels == null ? Map.of() : Map.copyOf(channels);
        codes = codes == null ? Map.of() : Map.copyOf(codes);
    }

    public static ReferenceData empty() {
        return new ReferenceData(Map.of(), Map.of());
    }

    public ReferenceChannel channel(String tvgId) {
        return tvgId == null ? null : channels.get(tvgId);
    }

    public EpgCode code(String tvgId) {
        return tvgId == null ? null : codes.get(tvgId);
    }
}
