package com.channelcatalog.verifier;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class VerificationPipelineTest {

    /** Prober answering from a fixed table; unknown URLs fail with a connection error. */
    private static class FakeProber implements StreamProberInterface {
        final Map<String, ProbeResult> answers = new HashMap<>();
        final List<String> probed = new ArrayList<>();

        @Override
        public ProbeResult probe(String url, int timeoutMs) throws IOException {
            probed.add(url);
            ProbeResult result = answers.get(url);
            if (result == null) throw new IOException("Connection refused");
            return result;
        }
    }

    private static VerificationPipeline pipeline(StreamProberInterface prober) {
        return new VerificationPipeline(prober, new MetadataEnricher(), new StatusClassifier(), new OriginCanonicalizer(),
            1000, 0, false, false);
    }

    private static Playlist playlist(Channel... channels) {
        return new Playlist(Path.of("us.m3u"), "us", Map.of(), new ArrayList<>(List.of(channels)));
    }

    @Test
    void testMirrorRewrittenToOrigin() throws Exception {
        FakeProber prober = new FakeProber();
        prober.answers.put("http://a.example/stream", ProbeResult.online(
            List.of(new MediaStream("video", 1280, 720)), List.of("http://a.example/stream", "http://b.example/live")));
        prober.answers.put("http://b.example/live", ProbeResult.online(List.of(), List.of("http://b.example/live")));

        Channel first = new Channel("A", "http://a.example/stream");
        Channel second = new Channel("B", "http://b.example/live");
        VerificationSummary summary = pipeline(prober).process(playlist(first, second), ReferenceData.empty());

        assertEquals("http://a.example/stream", first.getUrl());
        assertEquals("http://a.example/stream", second.getUrl());
        assertEquals(720, first.getResolution().height());
        assertEquals(2, summary.probed());
        assertEquals(2, summary.online());
        assertEquals(1, summary.rewritten());
        assertEquals(0, summary.errors());
    }

    @Test
    void testTransportErrorMarksOfflineAndContinues() throws Exception {
        FakeProber prober = new FakeProber();
        prober.answers.put("http://ok.example/x", ProbeResult.online(List.of(), List.of("http://ok.example/x")));

        Channel broken = new Channel("Broken", "http://down.example/x");
        Channel ok = new Channel("Ok", "http://ok.example/x");
        VerificationSummary summary = pipeline(prober).process(playlist(broken, ok), ReferenceData.empty());

        assertEquals("Offline", broken.getStatus());
        assertNull(ok.getStatus());
        assertEquals(1, summary.failed());
        assertEquals(1, summary.online());
        assertEquals(List.of("http://down.example/x", "http://ok.example/x"), prober.probed);
    }

    @Test
    void testChannelIsProbedBeforeEnrichment() throws Exception {
        Channel channel = new Channel("Morning Show", "http://m.example/x");
        List<String> idsSeenByProber = new ArrayList<>();
        StreamProberInterface prober = (url, timeoutMs) -> {
            idsSeenByProber.add(channel.getTvgId());
            return ProbeResult.failed(FailureReason.OTHER, "Server responded with 500");
        };

        pipeline(prober).process(playlist(channel), ReferenceData.empty());

        assertEquals(List.of(""), idsSeenByProber);
        assertEquals("Offline", channel.getStatus());
        assertEquals("MorningShow.us", channel.getTvgId());
    }

    @Test
    void testSentinelStatusesAreNotProbed() throws Exception {
        FakeProber prober = new FakeProber();
        Channel geo = new Channel("Geo", "http://geo.example/x");
        geo.setStatus("Geo-blocked");
        Channel part = new Channel("Part", "http://part.example/x");
        part.setStatus("Not 24/7");

        VerificationSummary summary = pipeline(prober).process(playlist(geo, part), ReferenceData.empty());

        assertTrue(prober.probed.isEmpty());
        assertEquals(2, summary.skipped());
        assertEquals("Geo-blocked", geo.getStatus());
        assertEquals("Not 24/7", part.getStatus());
        assertEquals("Geo.us", geo.getTvgId());
    }

    @Test
    void testUnexpectedErrorIsContainedPerChannel() throws Exception {
        StreamProberInterface prober = (url, timeoutMs) -> {
            if (url.contains("boom")) throw new IllegalStateException("boom");
            return ProbeResult.online(List.of(), List.of(url));
        };
        Channel boom = new Channel("Boom", "http://boom.example/x");
        Channel fine = new Channel("Fine", "http://fine.example/x");

        VerificationSummary summary = pipeline(prober).process(playlist(boom, fine), ReferenceData.empty());

        assertEquals(1, summary.errors());
        assertEquals(1, summary.online());
        assertEquals("Fine.us", fine.getTvgId());
    }

    @Test
    void testFailedProbeKeepsUrlAndTimeoutKeepsStatus() throws Exception {
        FakeProber prober = new FakeProber();
        prober.answers.put("http://slow.example/x", ProbeResult.failed(FailureReason.TIMEOUT, "timed out"));
        prober.answers.put("http://denied.example/x", ProbeResult.failed(FailureReason.FORBIDDEN, "Server responded with 403"));

        Channel slow = new Channel("Slow", "http://slow.example/x");
        slow.setStatus("Offline");
        Channel denied = new Channel("Denied", "http://denied.example/x");
        pipeline(prober).process(playlist(slow, denied), ReferenceData.empty());

        assertEquals("Offline", slow.getStatus());
        assertEquals("Offline", denied.getStatus());
        assertEquals("http://denied.example/x", denied.getUrl());
    }

    @Test
    void testOfflineModeEnrichesWithoutProbing() throws Exception {
        VerificationPipeline offline = new VerificationPipeline(null, null, null, null, 1000, 0, true, false);
        Channel channel = new Channel("Local News", "HTTP://Example.COM:80/live#x");

        VerificationSummary summary = offline.process(playlist(channel), ReferenceData.empty());

        assertEquals(1, summary.skipped());
        assertEquals(0, summary.probed());
        assertEquals("http://example.com/live", channel.getUrl());
        assertEquals("LocalNews.us", channel.getTvgId());
        assertEquals("English", channel.getTvgLanguage());
    }

    @Test
    void testProberRequiredUnlessOffline() {
        assertThrows(IllegalArgumentException.class,
            () -> new VerificationPipeline(null, null, null, null, 1000, 0, false, false));
    }

    @Test
    void testSecondPassIsIdempotent() throws Exception {
        FakeProber prober = new FakeProber();
        prober.answers.put("http://a.example/stream", ProbeResult.online(
            List.of(new MediaStream("video", 1920, 1080)), List.of("http://a.example/stream", "http://b.example/live")));
        prober.answers.put("http://b.example/live", ProbeResult.online(List.of(), List.of("http://b.example/live")));

        Channel first = new Channel("A", "http://a.example/stream");
        Channel second = new Channel("B", "http://b.example/live");
        second.setStatus("Offline");
        Playlist playlist = playlist(first, second);

        pipeline(prober).process(playlist, ReferenceData.empty());
        String afterFirst = playlist.toM3u();
        pipeline(prober).process(playlist, ReferenceData.empty());

        assertEquals(afterFirst, playlist.toM3u());
        assertEquals("Not 24/7", second.getStatus());
    }
}
