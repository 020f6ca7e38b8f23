package com.channelcatalog.verifier;

import java.util.List;

/**
 * Reference metadata for one tvg-id, as published by the channel feed.
 *
 * @param id tvg-id
 * @param logo logo URL, empty if none
 * @param languages language display names, in feed order
 * @param category category name, empty if none
 */
public record ReferenceChannel(String id, String logo, List<String> languages, String category) {

    public ReferenceChannel {
        logo = logo == null ? "" : logo;
        languages = languages == null ? List.of() : List.copyOf(languages);
        category = category == null ? "" : category;
    }

    /**
     * Merges a later feed entry with the same id into this one. Each field keeps the first
     * non-empty value: logo, then language list, then category.
     * @param later entry that appeared after this one in the feed
     * @return merged entry
     */
    public ReferenceChannel merge(ReferenceChannel later) {
        if (later == null) return this;
        return new ReferenceChannel(
            id,
            logo.isEmpty() ? later.logo() : logo,
            languages.isEmpty() ? later.languages() : languages,
            category.isEmpty() ? later.category() : category
        );
    }
}
