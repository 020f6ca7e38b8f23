package com.channelcatalog.generator;

import com.channelcatalog.verifier.Channel;
import com.channelcatalog.verifier.Country;
import com.channelcatalog.verifier.Language;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Serializes channels to the JSON snapshot consumed by programmatic clients.
 * Empty optional fields are written as {@code null}.
 */
public class ChannelJsonExporter {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public record Tvg(String id, String name, String url) {}

    public record Size(int width, int height) {}

    public record ChannelJson(
        String name,
        String logo,
        String url,
        String category,
        List<Language> languages,
        List<Country> countries,
        Tvg tvg,
        Size resolution,
        String status,
        boolean nsfw
    ) {}

    public static ChannelJson toJson(Channel channel) {
        return new ChannelJson(
            channel.getName(),
            orNull(channel.getLogo()),
            channel.getUrl(),
            orNull(channel.getGroupTitle()),
            channel.getLanguages(),
            channel.getCountries(),
            new Tvg(
                orNull(channel.getTvgId()),
                channel.getTvgName().isEmpty() ? channel.getName().replace("\"", "") : channel.getTvgName(),
                orNull(channel.getTvgUrl())
            ),
            channel.getResolution().height() > 0 ? new Size(channel.getResolution().width(), channel.getResolution().height()) : null,
            channel.getStatus(),
            channel.isNsfw()
        );
    }

    /**
     * Writes channels as a JSON array, in the given order.
     * @throws JsonProcessingException if serialization fails
     */
    public String export(List<Channel> channels) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsString(channels.stream().map(ChannelJsonExporter::toJson).collect(Collectors.toList()));
    }

    private static String orNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
