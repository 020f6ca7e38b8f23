package com.channelcatalog.verifier;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Access to the source playlists of the catalog.
 */
public interface PlaylistStoreInterface {
    /**
     * Lists playlist files, optionally restricted by country code.
     * @param includeCountries codes to keep; empty keeps all
     * @param excludeCountries codes to drop
     * @return playlist paths in a stable (sorted) order
     * @throws IOException if the store cannot be listed
     */
    List<Path> list(List<String> includeCountries, List<String> excludeCountries) throws IOException;

    /**
     * Reads a playlist's text.
     */
    String read(Path playlist) throws IOException;

    /**
     * Replaces a playlist's text.
     */
    void write(Path playlist, String text) throws IOException;

    /**
     * Country code a playlist file stands for, used as its default country.
     */
    String countryCodeOf(Path playlist);
}
