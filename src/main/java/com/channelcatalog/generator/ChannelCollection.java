package com.channelcatalog.generator;

import com.channelcatalog.verifier.Channel;
import com.channelcatalog.verifier.ChannelStatus;
import com.channelcatalog.verifier.Country;
import com.channelcatalog.verifier.Language;

import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Immutable, ordered view over catalog channels.
 * <p>
 * Every operation returns a new view and leaves the channels themselves untouched, so one catalog can
 * feed any number of output playlists. Typical composition:
 * <pre>
 * catalog.channels()
 *     .sortBy(List.of(NAME, STATUS, RESOLUTION_HEIGHT, URL), List.of(ASC, ASC, DESC, ASC))
 *     .forCountry(country)
 *     .removeDuplicates()
 *     .removeNSFW()
 *     .removeOffline()
 *     .get();
 * </pre>
 * Sorting before {@link #removeDuplicates()} decides which duplicate survives.
 *
 * @author Channel Catalog Team
 * @since 1.0
 */
public final class ChannelCollection {
    private final List<Channel> channels;

    public ChannelCollection(List<Channel> channels) {
        if (channels == null) throw new IllegalArgumentException("Channel list cannot be null");
        this.channels = List.copyOf(channels);
    }

    public ChannelCollection filter(Predicate<Channel> predicate) {
        return new ChannelCollection(channels.stream().filter(predicate).collect(Collectors.toList()));
    }

    /**
     * Channels associated with a country; {@code null} selects channels without any country.
     */
    public ChannelCollection forCountry(Country country) {
        if (country == null) return filter(c -> c.getCountries().isEmpty());
        return filter(c -> c.getCountries().stream().anyMatch(x -> x.code().equals(country.code())));
    }

    /**
     * Channels broadcasting in a language; {@code null} selects channels without a known language.
     */
    public ChannelCollection forLanguage(Language language) {
        if (language == null) return filter(c -> c.getLanguages().isEmpty());
        return filter(c -> c.getLanguages().stream().anyMatch(x -> x.code().equals(language.code())));
    }

    /**
     * Channels of a category; {@link CategoryRegistry#OTHER} selects channels outside the known categories.
     */
    public ChannelCollection forCategory(Category category) {
        if (category == null || CategoryRegistry.OTHER.id().equals(category.id())) {
            return filter(c -> !CategoryRegistry.isKnown(c.getCategoryId()));
        }
        return filter(c -> c.getCategoryId().equals(category.id()));
    }

    /**
     * Channels whose stored status equals the given label; {@code null} selects verified channels with no status.
     */
    public ChannelCollection forStatus(String status) {
        return filter(c -> Objects.equals(c.getStatus(), status));
    }

    /**
     * Channels verified online: no stored status, or {@code Not 24/7}.
     */
    public ChannelCollection onlineOnly() {
        return filter(c -> c.getStatus() == null || ChannelStatus.NOT_24_7.matches(c.getStatus()));
    }

    public ChannelCollection forNsfw(boolean nsfw) {
        return filter(c -> c.isNsfw() == nsfw);
    }

    /**
     * Stable multi-key sort. Keys are tie-breakers from left to right.
     * @param keys sort keys
     * @param directions one direction per key; missing entries default to ascending
     * @return sorted view
     */
    public ChannelCollection sortBy(List<SortKey> keys, List<SortKey.Direction> directions) {
        if (keys == null || keys.isEmpty()) return this;
        Comparator<Channel> comparator = null;
        for (int i = 0; i < keys.size(); i++) {
            SortKey.Direction direction = directions != null && i < directions.size() ? directions.get(i) : SortKey.Direction.ASC;
            Comparator<Channel> next = keys.get(i).comparator(direction);
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        List<Channel> sorted = new ArrayList<>(channels);
        sorted.sort(comparator);
        return new ChannelCollection(sorted);
    }

    public ChannelCollection sortBy(SortKey... keys) {
        return sortBy(Arrays.asList(keys), List.of());
    }

    /**
     * Keeps the first channel of each stream URL, in the current order.
     */
    public ChannelCollection removeDuplicates() {
        Set<String> seen = new HashSet<>();
        return filter(c -> seen.add(c.getUrl()));
    }

    public ChannelCollection removeOffline() {
        return filter(c -> !c.isOffline());
    }

    public ChannelCollection removeNSFW() {
        return filter(c -> !c.isNsfw());
    }

    public List<Channel> get() {
        return channels;
    }

    public int count() {
        return channels.size();
    }
}
