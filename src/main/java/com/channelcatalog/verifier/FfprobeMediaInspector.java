package com.channelcatalog.verifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Reads stream descriptors with a single {@code ffprobe -print_format json -show_streams} call.
 * Output goes to a temporary file so a stalled ffprobe can be killed at the deadline.
 */
public class FfprobeMediaInspector implements MediaInspectorInterface {
    private static final Logger logger = LoggerFactory.getLogger(FfprobeMediaInspector.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final long GRACE_MS = 1_000;

    private final String executable;

    public FfprobeMediaInspector(String executable) {
        this.executable = executable == null || executable.isBlank() ? "ffprobe" : executable;
    }

    public FfprobeMediaInspector() {
        this("ffprobe");
    }

    @Override
    public List<MediaStream> inspect(String url, int timeoutMs) throws IOException, InterruptedException {
        List<String> command = List.of(
            executable, "-v", "quiet",
            "-print_format", "json",
            "-show_streams",
            "-rw_timeout", String.valueOf(timeoutMs * 1000L),
            url
        );
        Path output = Files.createTempFile("ffprobe-", ".json");
        Process process = null;
        try {
            process = new ProcessBuilder(command)
                .redirectOutput(output.toFile())
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
            if (!process.waitFor(timeoutMs + GRACE_MS, TimeUnit.MILLISECONDS)) {
                logger.debug("ffprobe did not finish within {}ms for {}", timeoutMs, url);
                return List.of();
            }
            if (process.exitValue() != 0) {
                logger.debug("ffprobe exited with code {} for {}", process.exitValue(), url);
            }
            return parseStreams(Files.readString(output));
        } finally {
            // Also reached on interruption; the child must not outlive the probe.
            if (process != null && process.isAlive()) process.destroyForcibly();
            Files.deleteIfExists(output);
        }
    }

    /**
     * Parses the {@code streams} array of ffprobe JSON output. Unparseable output yields an empty list.
     */
    static List<MediaStream> parseStreams(String json) {
        List<MediaStream> streams = new ArrayList<>();
        if (json == null || json.isBlank()) return streams;
        try {
            JsonNode root = OBJECT_MAPPER.readTree(json);
            for (JsonNode stream : root.path("streams")) {
                streams.add(new MediaStream(
                    stream.path("codec_type").asText(""),
                    stream.path("width").asInt(0),
                    stream.path("height").asInt(0)
                ));
            }
        } catch (IOException e) {
            logger.warn("Failed to parse ffprobe output: {}", e.getMessage());
        }
        return streams;
    }
}
