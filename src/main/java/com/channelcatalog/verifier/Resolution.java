package com.channelcatalog.verifier;

/**
 * Measured video resolution of a stream. A zero height means "unknown".
 */
public record Resolution(int width, int height) {
    public static final Resolution UNKNOWN = new Resolution(0, 0);

    public boolean isKnown() {
        return width > 0 && height > 0;
    }
}
