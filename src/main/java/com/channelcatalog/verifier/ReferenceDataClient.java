package com.channelcatalog.verifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the reference datasets used for enrichment.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Fetches the channel feed (JSON array of channels with {@code tvg.id}, {@code logo},
 *       {@code languages} and {@code category}) and merges duplicate ids with {@link ReferenceChannel#merge}.</li>
 *   <li>Fetches the EPG code feed (JSON array of {@code tvg_id} / {@code logo}); a later entry of an id replaces an earlier one.</li>
 * </ul>
 * Error Handling:
 * <ul>
 *   <li>Non-200 answers, network errors and malformed JSON are logged and produce an empty map.</li>
 *   <li>A failed feed never aborts a run; enrichment simply has less to work with.</li>
 * </ul>
 *
 * @author Channel Catalog Team
 * @since 1.0
 */
public class ReferenceDataClient {
    private static final Logger logger = LoggerFactory.getLogger(ReferenceDataClient.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public static final String DEFAULT_CHANNELS_FEED = "https://iptv-org.github.io/iptv/channels.json";
    public static final String DEFAULT_CODES_FEED = "https://iptv-org.github.io/epg/codes.json";

    private final HttpClient client;
    private final Duration timeout;

    public ReferenceDataClient(Duration timeout) {
        this.timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(this.timeout)
            .build();
    }

    public ReferenceDataClient() {
        this(Duration.ofSeconds(30));
    }

    /**
     * Loads both feeds.
     * @param channelsFeed URL of the channel feed
     * @param codesFeed URL of the EPG code feed
     * @return reference data, possibly with empty maps
     * @throws InterruptedException if interrupted while waiting for a feed
     */
    public ReferenceData load(String channelsFeed, String codesFeed) throws InterruptedException {
        Map<String, ReferenceChannel> channels = loadChannels(channelsFeed);
        Map<String, EpgCode> codes = loadCodes(codesFeed);
        logger.info("Loaded reference data: {} channels, {} EPG codes.", channels.size(), codes.size());
        return new ReferenceData(channels, codes);
    }

    public Map<String, ReferenceChannel> loadChannels(String url) throws InterruptedException {
        try {
            return parseChannels(fetch(url));
        } catch (IOException e) {
            logger.warn("Failed to load channel feed {}: {}", url, e.getMessage());
            return Map.of();
        }
    }

    public Map<String, EpgCode> loadCodes(String url) throws InterruptedException {
        try {
            return parseCodes(fetch(url));
        } catch (IOException e) {
            logger.warn("Failed to load EPG codes {}: {}", url, e.getMessage());
            return Map.of();
        }
    }

    private String fetch(String url) throws IOException, InterruptedException {
        if (url == null || url.isBlank()) throw new IOException("No feed URL configured");
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid feed URL: " + url, e);
        }
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("HTTP " + response.statusCode());
        }
        return response.body();
    }

    /**
     * Parses the channel feed, merging entries that share a tvg-id. Entries without an id are skipped.
     * @param json feed body
     * @return merged entries keyed by tvg-id, in first-seen order
     * @throws IOException if the JSON cannot be read
     */
    static Map<String, ReferenceChannel> parseChannels(String json) throws IOException {
        Map<String, ReferenceChannel> out = new LinkedHashMap<>();
        JsonNode root = OBJECT_MAPPER.readTree(json);
        if (root == null || !root.isArray()) throw new IOException("Channel feed is not a JSON array");
        for (JsonNode node : root) {
            String id = node.path("tvg").path("id").asText("");
            if (id.isBlank()) continue;
            List<String> languages = new ArrayList<>();
            for (JsonNode language : node.path("languages")) {
                String name = language.isTextual() ? language.asText() : language.path("name").asText("");
                if (!name.isBlank()) languages.add(name);
            }
            ReferenceChannel entry = new ReferenceChannel(
                id,
                node.path("logo").asText(""),
                languages,
                node.path("category").asText("")
            );
            out.merge(id, entry, ReferenceChannel::merge);
        }
        return out;
    }

    /**
     * Parses the EPG code feed. The last entry of each tvg-id is kept.
     * @param json feed body
     * @return entries keyed by tvg-id
     * @throws IOException if the JSON cannot be read
     */
    static Map<String, EpgCode> parseCodes(String json) throws IOException {
        Map<String, EpgCode> out = new LinkedHashMap<>();
        JsonNode root = OBJECT_MAPPER.readTree(json);
        if (root == null || !root.isArray()) throw new IOException("EPG code feed is not a JSON array");
        for (JsonNode node : root) {
            String id = node.path("tvg_id").asText("");
            if (id.isBlank()) continue;
            out.put(id, new EpgCode(id, node.path("logo").asText("")));
        }
        return out;
    }
}
