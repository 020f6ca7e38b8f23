package com.channelcatalog.verifier;

/**
 * Outcome of classifying a single probe. Exactly one value is produced per probe result.
 */
public enum ProbeStatus {
    ONLINE,
    OFFLINE,
    TIMEOUT,
    ERROR_40X,
    ERROR_403
}
