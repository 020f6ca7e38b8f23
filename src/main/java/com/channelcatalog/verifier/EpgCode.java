package com.channelcatalog.verifier;

/**
 * Entry of the EPG code feed: a tvg-id known to a guide provider and its logo.
 */
public record EpgCode(String tvgId, String logo) {

    public EpgCode {
        logo = logo == null ? "" : logo;
    }
}
