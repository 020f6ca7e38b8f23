package com.channelcatalog.verifier;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CatalogVerifierTest {

    @TempDir
    Path dir;

    private CatalogConfig config(boolean offline, List<String> include) {
        return new CatalogConfig(1000, 0, offline, false, include, List.of(), dir, dir.resolve("out"), null, null);
    }

    @Test
    void testOfflineRunEnrichesAndRewritesChangedFilesOnly() throws Exception {
        Path us = dir.resolve("us.m3u");
        Files.writeString(us, "#EXTM3U\n#EXTINF:-1,Local News\nhttp://news.example/live\n");
        Path fr = dir.resolve("fr.m3u");
        String frText = "#EXTM3U\n"
            + "#EXTINF:-1 tvg-id=\"Info.fr\" tvg-name=\"Info\" tvg-country=\"FR\" tvg-language=\"French\" "
            + "tvg-logo=\"\" group-title=\"\",Info\n"
            + "http://info.example/live\n";
        Files.writeString(fr, frText);

        CatalogVerifier verifier = new CatalogVerifier(config(true, List.of()), new PlaylistStore(dir), null, null);
        List<VerificationSummary> summaries = verifier.run();

        assertEquals(2, summaries.size());
        assertFalse(summaries.get(0).updated());
        assertTrue(summaries.get(1).updated());
        assertEquals(frText, Files.readString(fr));
        String usText = Files.readString(us);
        assertTrue(usText.contains("tvg-id=\"LocalNews.us\""));
        assertTrue(usText.contains("tvg-country=\"US\""));
        assertTrue(usText.contains("tvg-language=\"English\""));
    }

    @Test
    void testRunIsIdempotent() throws Exception {
        Path us = dir.resolve("us.m3u");
        Files.writeString(us, "#EXTM3U\n#EXTINF:-1,Local News\nhttp://news.example/live\n");
        PlaylistStore store = new PlaylistStore(dir);

        new CatalogVerifier(config(true, List.of()), store, null, null).run();
        String first = Files.readString(us);
        List<VerificationSummary> second = new CatalogVerifier(config(true, List.of()), store, null, null).run();

        assertFalse(second.get(0).updated());
        assertEquals(first, Files.readString(us));
    }

    @Test
    void testNothingSelected() throws Exception {
        Files.writeString(dir.resolve("us.m3u"), "#EXTM3U\n");
        CatalogVerifier verifier = new CatalogVerifier(config(true, List.of("zz")), new PlaylistStore(dir), null, null);
        assertTrue(verifier.run().isEmpty());
    }

    @Test
    void testUnreadablePlaylistIsSkipped() throws Exception {
        PlaylistStoreInterface store = new PlaylistStore(dir) {
            @Override
            public List<Path> list(List<String> include, List<String> exclude) {
                return List.of(dir.resolve("gone.m3u"), dir.resolve("us.m3u"));
            }
        };
        Files.writeString(dir.resolve("us.m3u"), "#EXTM3U\n");

        List<VerificationSummary> summaries = new CatalogVerifier(config(true, List.of()), store, null, null).run();

        assertEquals(1, summaries.size());
        assertEquals(dir.resolve("us.m3u"), summaries.get(0).playlist());
    }

    @Test
    void testOnlineRunUsesProber() throws Exception {
        Path us = dir.resolve("us.m3u");
        Files.writeString(us, "#EXTM3U\n#EXTINF:-1,Gone\nhttp://gone.example/x\n");
        StreamProberInterface prober = (url, timeoutMs) -> { throw new IOException("Connection refused"); };

        new CatalogVerifier(config(false, List.of()), new PlaylistStore(dir), prober, null).run();

        assertTrue(Files.readString(us).contains(",Gone [Offline]\n"));
    }

    @Test
    void testConfigAndStoreRequired() {
        assertThrows(IllegalArgumentException.class, () -> new CatalogVerifier(null, new PlaylistStore(dir), null, null));
    }
}
