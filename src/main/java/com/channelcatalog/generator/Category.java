package com.channelcatalog.generator;

/**
 * Output category; {@code id} is the lower-cased group title used in file names.
 */
public record Category(String id, String name) {}
