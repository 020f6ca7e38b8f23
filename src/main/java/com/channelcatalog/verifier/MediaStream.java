package com.channelcatalog.verifier;

/**
 * One elementary stream reported by a probe ({@code codec_type} plus frame size for video).
 */
public record MediaStream(String codecType, int width, int height) {

    public boolean isVideo() {
        return "video".equalsIgnoreCase(codecType);
    }
}
