package com.channelcatalog.verifier;

/**
 * Broadcast language of a channel, identified by its ISO 639-3 code.
 */
public record Language(String code, String name) {}
