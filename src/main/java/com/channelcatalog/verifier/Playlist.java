package com.channelcatalog.verifier;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * A source playlist and the channels it owns.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Read from the {@link PlaylistStoreInterface} and parsed by {@link M3uPlaylistCodec}.</li>
 *   <li>Its channels are updated in place by one {@link VerificationPipeline} pass.</li>
 *   <li>Serialized back with {@link #toM3u()} and written only if the text changed.</li>
 * </ul>
 *
 * @param source file the playlist was read from
 * @param countryCode default country code, used as the suffix of derived tvg-ids
 * @param headerAttributes attributes of the {@code #EXTM3U} line, in file order
 * @param channels entries in file order
 */
public record Playlist(Path source, String countryCode, Map<String, String> headerAttributes, List<Channel> channels) {

    public Playlist {
        if (source == null) throw new IllegalArgumentException("Playlist source cannot be null");
        countryCode = countryCode == null ? "" : countryCode.toLowerCase();
        headerAttributes = headerAttributes == null ? Map.of() : Map.copyOf(headerAttributes);
        if (channels == null) throw new IllegalArgumentException("Channel list cannot be null");
    }

    public String toM3u() {
        StringBuilder sb = new StringBuilder("#EXTM3U");
        headerAttributes.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(e -> sb.append(' ').append(e.getKey()).append("=\"").append(e.getValue()).append('"'));
        sb.append('\n');
        for (Channel channel : channels) {
            sb.append(channel.toM3u());
        }
        return sb.toString();
    }
}
