package com.channelcatalog.verifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stream prober backed by {@link HttpClient}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Issues a GET for the URL with automatic redirects disabled and follows {@code Location}
 *       headers itself (up to {@value #MAX_REDIRECTS} hops), recording every requested URL.</li>
 *   <li>Maps non-2xx answers to a {@link FailureReason} and request time-outs to {@link FailureReason#TIMEOUT}.</li>
 *   <li>On a 2xx answer, asks the {@link MediaInspectorInterface} for stream descriptors. Inspection
 *       problems never turn a reachable stream into a failure.</li>
 * </ul>
 * One {@link HttpClient} serves every probe of the instance. Only the response headers are read;
 * the body is closed right away.
 *
 * @author Channel Catalog Team
 * @since 1.0
 */
public class HttpStreamProber implements StreamProberInterface {
    private static final Logger logger = LoggerFactory.getLogger(HttpStreamProber.class);
    static final int MAX_REDIRECTS = 10;
    private static final String DEFAULT_USER_AGENT = "ChannelCatalog/1.0";
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofMillis(CatalogConfig.DEFAULT_TIMEOUT_MS);

    private final MediaInspectorInterface mediaInspector;
    private final HttpClient client;

    /**
     * @param mediaInspector stream inspector for reachable URLs; null inspects nothing
     * @param connectTimeout connect timeout shared by all probes; request timeouts are set per probe
     */
    public HttpStreamProber(MediaInspectorInterface mediaInspector, Duration connectTimeout) {
        this.mediaInspector = mediaInspector == null ? (url, timeoutMs) -> List.of() : mediaInspector;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout)
            .build();
    }

    public HttpStreamProber(MediaInspectorInterface mediaInspector) {
        this(mediaInspector, DEFAULT_CONNECT_TIMEOUT);
    }

    public HttpStreamProber() {
        this(new FfprobeMediaInspector());
    }

    HttpClient client() {
        return client;
    }

    @Override
    public ProbeResult probe(String url, int timeoutMs) throws IOException, InterruptedException {
        Duration timeout = Duration.ofMillis(Math.max(1, timeoutMs));

        List<String> chain = new ArrayList<>();
        String current = url;
        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            URI uri;
            HttpRequest request;
            try {
                uri = Utils.toUri(current);
                request = HttpRequest.newBuilder(uri)
                    .timeout(timeout)
                    .header("User-Agent", DEFAULT_USER_AGENT)
                    .GET()
                    .build();
            } catch (URISyntaxException | IllegalArgumentException e) {
                return ProbeResult.failed(FailureReason.OTHER, "Invalid URL: " + current);
            }
            chain.add(current);

            HttpResponse<InputStream> response;
            try {
                response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            } catch (HttpTimeoutException e) {
                return ProbeResult.failed(FailureReason.TIMEOUT, "Request timed out after " + timeoutMs + "ms");
            }
            try (InputStream ignored = response.body()) {
                int code = response.statusCode();
                if (code >= 300 && code < 400) {
                    Optional<String> location = response.headers().firstValue("Location");
                    if (location.isEmpty()) {
                        return ProbeResult.failed(FailureReason.OTHER, "Redirect " + code + " without Location header");
                    }
                    try {
                        current = uri.resolve(Utils.toUri(location.get())).toString();
                    } catch (URISyntaxException e) {
                        return ProbeResult.failed(FailureReason.OTHER, "Invalid redirect target: " + location.get());
                    }
                    continue;
                }
                if (code < 200 || code >= 300) {
                    return ProbeResult.failed(FailureReason.fromStatusCode(code), "Server responded with " + code);
                }
            }
            return ProbeResult.online(inspect(current, timeoutMs), chain);
        }
        return ProbeResult.failed(FailureReason.OTHER, "Too many redirects (" + MAX_REDIRECTS + ")");
    }

    private List<MediaStream> inspect(String url, int timeoutMs) throws InterruptedException {
        try {
            return mediaInspector.inspect(url, timeoutMs);
        } catch (IOException e) {
            logger.debug("Media inspection unavailable for {}: {}", url, e.getMessage());
            return List.of();
        }
    }
}
