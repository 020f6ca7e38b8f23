package com.channelcatalog.generator;

import com.channelcatalog.verifier.Channel;
import com.channelcatalog.verifier.Country;
import com.channelcatalog.verifier.Language;
import com.channelcatalog.verifier.M3uPlaylistCodec;
import com.channelcatalog.verifier.Playlist;
import com.channelcatalog.verifier.PlaylistStoreInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * All verified channels of all source playlists, plus the partitions derived from them.
 * Read-only once loaded.
 *
 * @author Channel Catalog Team
 * @since 1.0
 */
public class Catalog {
    private static final Logger logger = LoggerFactory.getLogger(Catalog.class);

    private final List<Channel> channels;
    private final List<Country> countries;
    private final List<Language> languages;

    public Catalog(List<Channel> channels) {
        if (channels == null) throw new IllegalArgumentException("Channel list cannot be null");
        this.channels = List.copyOf(channels);
        this.countries = collect(this.channels.stream().flatMap(c -> c.getCountries().stream()), Country::name);
        this.languages = collect(this.channels.stream().flatMap(c -> c.getLanguages().stream()), Language::name);
    }

    /**
     * Loads every playlist of the store. Playlists that cannot be read are logged and skipped.
     * @param store playlist store
     * @param codec M3U codec
     * @return catalog of all readable channels, in store order
     * @throws IOException if the store cannot be listed
     */
    public static Catalog load(PlaylistStoreInterface store, M3uPlaylistCodec codec) throws IOException {
        List<Channel> all = new ArrayList<>();
        for (Path file : store.list(List.of(), List.of())) {
            try {
                Playlist playlist = codec.parse(store.read(file), file, store.countryCodeOf(file));
                all.addAll(playlist.channels());
            } catch (IOException e) {
                logger.error("Failed to load playlist '{}': {}", file, e.getMessage());
            }
        }
        logger.info("Loaded {} channels.", all.size());
        return new Catalog(all);
    }

    private static <T> List<T> collect(Stream<T> items, Function<T, String> name) {
        return items.distinct()
            .sorted(Comparator.comparing(name))
            .collect(Collectors.toUnmodifiableList());
    }

    public ChannelCollection channels() {
        return new ChannelCollection(channels);
    }

    /** Countries with at least one channel, sorted by name. */
    public List<Country> countries() {
        return countries;
    }

    /** Languages with at least one channel, sorted by name. */
    public List<Language> languages() {
        return languages;
    }

    public List<Category> categories() {
        return CategoryRegistry.getCategories();
    }
}
