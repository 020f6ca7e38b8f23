package com.channelcatalog.verifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads playlists in the extended M3U format understood by the catalog.
 * <p>
 * Only the directives the catalog round-trips are interpreted: {@code #EXTM3U} header attributes,
 * {@code #EXTINF} attributes and title, {@code #EXTGRP} category hints and
 * {@code #EXTVLCOPT} referrer / user-agent options. Other comment lines are dropped.
 *
 * @author Channel Catalog Team
 * @since 1.0
 */
public class M3uPlaylistCodec {
    private static final Logger logger = LoggerFactory.getLogger(M3uPlaylistCodec.class);

    private static final Pattern ATTR = Pattern.compile("([\\w-]+)\\s*=\\s*\"([^\"]*)\"");
    private static final Pattern TITLE = Pattern.compile("^(.*?)(?:\\s+\\((\\d+)p\\))?(?:\\s+\\[([^\\]]+)\\])?$");
    private static final Pattern NSFW_WORDS = Pattern.compile("(?i)(^|[^a-z])(xxx|porn|adult)([^a-z]|$)");
    private static final String NSFW_GROUP = "XXX";

    /**
     * Parses playlist text.
     * @param text M3U text
     * @param source file the text came from
     * @param countryCode default country code of the playlist
     * @return parsed playlist, channels in file order
     */
    public Playlist parse(String text, Path source, String countryCode) {
        Map<String, String> header = new LinkedHashMap<>();
        List<Channel> channels = new ArrayList<>();
        if (text == null || text.isBlank()) {
            logger.warn("Playlist '{}' is empty.", source);
            return new Playlist(source, countryCode, header, channels);
        }

        Channel pending = null;
        int lineNo = 0;
        for (String raw : text.split("\\R")) {
            lineNo++;
            String line = raw.trim();
            if (line.isEmpty()) continue;

            if (line.startsWith("#EXTM3U")) {
                header.putAll(attributes(line));
            } else if (line.startsWith("#EXTINF")) {
                if (pending != null) {
                    logger.warn("Entry '{}' in '{}' has no URL before line {}; dropped.", pending.getName(), source, lineNo);
                }
                pending = parseInfo(line);
            } else if (line.startsWith("#EXTGRP:") && pending != null) {
                pending.setCategory(line.substring("#EXTGRP:".length()).trim());
            } else if (line.startsWith("#EXTVLCOPT:") && pending != null) {
                applyOption(pending, line.substring("#EXTVLCOPT:".length()));
            } else if (!line.startsWith("#")) {
                if (pending == null) {
                    logger.warn("URL without #EXTINF at line {} of '{}'; skipped.", lineNo, source);
                    continue;
                }
                pending.setUrl(line);
                pending.setNsfw(isNsfw(pending));
                channels.add(pending);
                pending = null;
            }
        }
        return new Playlist(source, countryCode, header, channels);
    }

    private Channel parseInfo(String line) {
        Channel channel = new Channel();
        String attrPart = line;
        String title = "";
        int comma = firstUnquotedComma(line);
        if (comma >= 0) {
            attrPart = line.substring(0, comma);
            title = line.substring(comma + 1).trim();
        }
        Map<String, String> attrs = attributes(attrPart);
        channel.setTvgId(attrs.get("tvg-id"));
        channel.setTvgName(attrs.get("tvg-name"));
        channel.setTvgLanguage(attrs.get("tvg-language"));
        channel.setTvgUrl(attrs.get("tvg-url"));
        channel.setLogo(attrs.get("tvg-logo"));
        channel.setGroupTitle(attrs.get("group-title"));
        channel.setUserAgent(attrs.get("user-agent"));
        channel.setHttpReferrer(attrs.get("http-referrer"));

        String tvgCountry = attrs.getOrDefault("tvg-country", "");
        List<Country> countries = new ArrayList<>();
        for (String code : tvgCountry.split(";")) {
            Country country = CountryRegistry.byCode(code);
            if (country != null) countries.add(country);
        }
        if (countries.isEmpty()) {
            channel.setTvgCountry(tvgCountry);
        } else {
            channel.setCountries(countries);
        }

        Matcher m = TITLE.matcher(title);
        if (m.matches()) {
            channel.setName(m.group(1).trim());
            if (m.group(2) != null) channel.setResolution(new Resolution(0, Integer.parseInt(m.group(2))));
            channel.setStatus(m.group(3));
        } else {
            channel.setName(title);
        }
        return channel;
    }

    // Attribute values may contain commas, so the title starts after the first comma outside quotes.
    private static int firstUnquotedComma(String line) {
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') quoted = !quoted;
            else if (c == ',' && !quoted) return i;
        }
        return -1;
    }

    private static Map<String, String> attributes(String s) {
        Map<String, String> out = new LinkedHashMap<>();
        Matcher m = ATTR.matcher(s);
        while (m.find()) {
            out.put(m.group(1).toLowerCase(), m.group(2).trim());
        }
        return out;
    }

    private static void applyOption(Channel channel, String option) {
        int eq = option.indexOf('=');
        if (eq < 0) return;
        String key = option.substring(0, eq).trim().toLowerCase();
        String value = option.substring(eq + 1).trim();
        if ("http-referrer".equals(key)) channel.setHttpReferrer(value);
        else if ("http-user-agent".equals(key)) channel.setUserAgent(value);
    }

    static boolean isNsfw(Channel channel) {
        if (NSFW_GROUP.equalsIgnoreCase(channel.getGroupTitle()) || NSFW_GROUP.equalsIgnoreCase(channel.getCategory())) {
            return true;
        }
        return NSFW_WORDS.matcher(channel.getTvgId()).find() || NSFW_WORDS.matcher(channel.getName()).find();
    }
}
