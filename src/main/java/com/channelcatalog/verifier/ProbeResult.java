package com.channelcatalog.verifier;

import java.util.List;

/**
 * Structured answer of a {@link StreamProberInterface}.
 * <p>
 * On success {@code streams} and {@code requestChain} are populated; the first chain entry is the
 * URL originally requested, the rest are redirect targets in the order they were followed.
 * On failure {@code reason} and {@code reasonText} describe what went wrong.
 *
 * @author Channel Catalog Team
 * @since 1.0
 */
public record ProbeResult(
    boolean ok,
    FailureReason reason,
    String reasonText,
    List<MediaStream> streams,
    List<String> requestChain
) {
    public ProbeResult {
        streams = streams == null ? List.of() : List.copyOf(streams);
        requestChain = requestChain == null ? List.of() : List.copyOf(requestChain);
    }

    public static ProbeResult online(List<MediaStream> streams, List<String> requestChain) {
        return new ProbeResult(true, null, null, streams, requestChain);
    }

    public static ProbeResult failed(FailureReason reason, String reasonText) {
        return new ProbeResult(false, reason == null ? FailureReason.OTHER : reason, reasonText, List.of(), List.of());
    }

    /**
     * Builds a failed result from a free-text message only.
     */
    public static ProbeResult failed(String reasonText) {
        return failed(FailureReason.fromText(reasonText), reasonText);
    }
}
