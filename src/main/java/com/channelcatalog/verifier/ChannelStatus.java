package com.channelcatalog.verifier;

/**
 * Stored health labels written next to a channel's title in the playlist, e.g. {@code [Offline]}.
 * <p>
 * {@link #GEO_BLOCKED} and {@link #NOT_24_7} are curated by hand and are never re-probed.
 */
public enum ChannelStatus {
    GEO_BLOCKED("Geo-blocked"),
    NOT_24_7("Not 24/7"),
    OFFLINE("Offline");

    private final String label;

    ChannelStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean matches(String stored) {
        return label.equals(stored);
    }

    /**
     * Returns true when the stored label marks a channel that the pipeline must not probe.
     */
    public static boolean isSentinel(String stored) {
        return GEO_BLOCKED.matches(stored) || NOT_24_7.matches(stored);
    }
}
