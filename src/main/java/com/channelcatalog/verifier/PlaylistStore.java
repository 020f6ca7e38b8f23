package com.channelcatalog.verifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Directory-backed playlist store: one {@code <cc>.m3u} or {@code <cc>_<suffix>.m3u} file per playlist,
 * where {@code <cc>} is the country code the playlist belongs to.
 *
 * @author Channel Catalog Team
 * @since 1.0
 */
public class PlaylistStore implements PlaylistStoreInterface {
    private static final Logger logger = LoggerFactory.getLogger(PlaylistStore.class);
    private static final String EXTENSION = ".m3u";

    private final Path root;

    public PlaylistStore(Path root) {
        if (root == null) throw new IllegalArgumentException("Playlist directory cannot be null");
        this.root = root;
    }

    @Override
    public List<Path> list(List<String> includeCountries, List<String> excludeCountries) throws IOException {
        if (!Files.isDirectory(root)) {
            logger.warn("Playlist directory '{}' does not exist.", root);
            return List.of();
        }
        try (Stream<Path> files = Files.list(root)) {
            return files
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                .filter(p -> includeCountries == null || includeCountries.isEmpty() || includeCountries.contains(countryCodeOf(p)))
                .filter(p -> excludeCountries == null || !excludeCountries.contains(countryCodeOf(p)))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    @Override
    public String read(Path playlist) throws IOException {
        return Files.readString(playlist, StandardCharsets.UTF_8);
    }

    @Override
    public void write(Path playlist, String text) throws IOException {
        Path parent = playlist.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(playlist, text, StandardCharsets.UTF_8);
    }

    @Override
    public String countryCodeOf(Path playlist) {
        String name = playlist.getFileName().toString();
        if (name.endsWith(EXTENSION)) name = name.substring(0, name.length() - EXTENSION.length());
        int underscore = name.indexOf('_');
        return (underscore >= 0 ? name.substring(0, underscore) : name).toLowerCase();
    }
}
