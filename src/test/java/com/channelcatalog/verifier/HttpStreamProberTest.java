package com.channelcatalog.verifier;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

public class HttpStreamProberTest {
    private HttpServer server;
    private ExecutorService executor;
    private String base;
    private final HttpStreamProber prober = new HttpStreamProber((url, timeoutMs) -> List.of(new MediaStream("video", 1280, 720)));

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.createContext("/live", exchange -> respond(exchange, 200, "#EXTM3U"));
        server.createContext("/signed.m3u8", exchange -> {
            String query = exchange.getRequestURI().getRawQuery();
            respond(exchange, "sig=a%7Cb".equals(query) ? 200 : 400, "#EXTM3U");
        });
        server.createContext("/redirect", exchange -> redirect(exchange, "/live"));
        server.createContext("/loop", exchange -> redirect(exchange, "/loop"));
        server.createContext("/nolocation", exchange -> respond(exchange, 302, ""));
        server.createContext("/forbidden", exchange -> respond(exchange, 403, "no"));
        server.createContext("/legal", exchange -> respond(exchange, 451, "no"));
        server.createContext("/missing", exchange -> respond(exchange, 404, "no"));
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(3000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "late");
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        executor.shutdownNow();
    }

    private static void respond(HttpExchange exchange, int code, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(code, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static void redirect(HttpExchange exchange, String location) throws IOException {
        exchange.getResponseHeaders().add("Location", location);
        exchange.sendResponseHeaders(302, -1);
        exchange.close();
    }

    @Test
    void testOnlineWithStreams() throws Exception {
        ProbeResult result = prober.probe(base + "/live", 2000);
        assertTrue(result.ok());
        assertEquals(List.of(base + "/live"), result.requestChain());
        assertEquals(List.of(new MediaStream("video", 1280, 720)), result.streams());
    }

    @Test
    void testRedirectChainIsRecorded() throws Exception {
        ProbeResult result = prober.probe(base + "/redirect", 2000);
        assertTrue(result.ok());
        assertEquals(List.of(base + "/redirect", base + "/live"), result.requestChain());
    }

    @Test
    void testErrorCodesMapToReasons() throws Exception {
        assertEquals(FailureReason.FORBIDDEN, prober.probe(base + "/forbidden", 2000).reason());
        assertEquals(FailureReason.UNEXPECTED_CLIENT_ERROR, prober.probe(base + "/legal", 2000).reason());
        ProbeResult missing = prober.probe(base + "/missing", 2000);
        assertFalse(missing.ok());
        assertEquals(FailureReason.OTHER, missing.reason());
        assertEquals("Server responded with 404", missing.reasonText());
    }

    @Test
    void testBrokenRedirects() throws Exception {
        assertEquals(FailureReason.OTHER, prober.probe(base + "/loop", 2000).reason());
        assertEquals(FailureReason.OTHER, prober.probe(base + "/nolocation", 2000).reason());
    }

    @Test
    void testTimeout() throws Exception {
        ProbeResult result = prober.probe(base + "/slow", 300);
        assertFalse(result.ok());
        assertEquals(FailureReason.TIMEOUT, result.reason());
    }

    @Test
    void testConnectionFailureThrows() {
        assertThrows(IOException.class, () -> prober.probe("http://127.0.0.1:1/x", 1000));
    }

    @Test
    void testInspectionFailureKeepsStreamOnline() throws Exception {
        HttpStreamProber blind = new HttpStreamProber((url, timeoutMs) -> { throw new IOException("no ffprobe"); });
        ProbeResult result = blind.probe(base + "/live", 2000);
        assertTrue(result.ok());
        assertTrue(result.streams().isEmpty());
    }

    @Test
    void testClientIsSharedAcrossProbes() throws Exception {
        var client = prober.client();
        prober.probe(base + "/live", 2000);
        prober.probe(base + "/redirect", 2000);
        prober.probe(base + "/missing", 2000);
        assertSame(client, prober.client());
    }

    @Test
    void testDecodedQueryIsReEncodedForTheRequest() throws Exception {
        String decoded = Utils.normalizeUrl(base + "/signed.m3u8?sig=a%7Cb");
        assertEquals(base + "/signed.m3u8?sig=a|b", decoded);

        ProbeResult result = prober.probe(decoded, 2000);
        assertTrue(result.ok());
        assertEquals(List.of(decoded), result.requestChain());
    }

    @Test
    void testEncodedQueryStaysOnlineThroughPipeline() throws Exception {
        Channel signed = new Channel("Signed", base + "/signed.m3u8?sig=a%7Cb");
        Channel mirror = new Channel("Mirror", base + "/signed.m3u8?sig=a|b");
        Playlist playlist = new Playlist(Path.of("us.m3u"), "us", Map.of(), new ArrayList<>(List.of(signed, mirror)));
        VerificationPipeline pipeline = new VerificationPipeline(prober, new MetadataEnricher(), new StatusClassifier(),
            new OriginCanonicalizer(), 2000, 0, false, false);

        VerificationSummary summary = pipeline.process(playlist, ReferenceData.empty());

        assertNull(signed.getStatus());
        assertNull(mirror.getStatus());
        assertEquals(2, summary.online());
        assertEquals(base + "/signed.m3u8?sig=a|b", signed.getUrl());
        assertEquals(OriginCanonicalizer.ProbeType.ORIGIN,
            new OriginCanonicalizer().typeOf(signed.getUrl(), List.of(signed.getUrl())));
    }

    @Test
    void testInvalidUrl() throws Exception {
        ProbeResult result = prober.probe("http://bad host/x", 1000);
        assertFalse(result.ok());
        assertEquals(FailureReason.OTHER, result.reason());
    }
}
