package com.channelcatalog.verifier;

/**
 * Country association of a channel, e.g. {@code us / United States}.
 * Codes are kept lower-case, as they appear in tvg-id suffixes and playlist file names.
 */
public record Country(String code, String name) {}
