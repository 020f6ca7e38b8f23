package com.channelcatalog.verifier;

import java.util.List;

/**
 * Maps probe results to health states and applies them to stored channel status.
 * <p>
 * Classification priority: success, time-out, 403, other unexpected 4xx, everything else.
 * Every result yields exactly one {@link ProbeStatus}.
 *
 * @author Channel Catalog Team
 * @since 1.0
 */
public class StatusClassifier {

    /**
     * Classifies a probe result.
     * @param result probe result, may be null (treated as an unexplained failure)
     * @return health state
     */
    public ProbeStatus classify(ProbeResult result) {
        if (result == null) return ProbeStatus.OFFLINE;
        if (result.ok()) return ProbeStatus.ONLINE;
        FailureReason reason = result.reason() != null ? result.reason() : FailureReason.fromText(result.reasonText());
        return switch (reason) {
            case TIMEOUT -> ProbeStatus.TIMEOUT;
            case FORBIDDEN -> ProbeStatus.ERROR_403;
            case UNEXPECTED_CLIENT_ERROR -> ProbeStatus.ERROR_40X;
            case OTHER -> ProbeStatus.OFFLINE;
        };
    }

    /**
     * Applies a classification to the channel's stored status.
     * <ul>
     *   <li>ONLINE clears the status, except that a previously {@code Offline} channel becomes {@code Not 24/7}.</li>
     *   <li>OFFLINE and ERROR_403 mark the channel {@code Offline}.</li>
     *   <li>TIMEOUT and ERROR_40X leave the stored status as it is.</li>
     * </ul>
     */
    public void updateStatus(Channel channel, ProbeStatus status) {
        switch (status) {
            case ONLINE -> channel.setStatus(channel.isOffline() ? ChannelStatus.NOT_24_7.label() : null);
            case OFFLINE, ERROR_403 -> channel.setStatus(ChannelStatus.OFFLINE.label());
            default -> { }
        }
    }

    /**
     * Stores a measured resolution unless one is already known. Resolutions are never downgraded.
     */
    public void updateResolution(Channel channel, Resolution measured) {
        if (channel.getResolution().height() == 0 && measured != null) {
            channel.setResolution(measured);
        }
    }

    /**
     * Picks the tallest video stream.
     * @param streams stream descriptors of a successful probe
     * @return resolution, or null if no video stream reports a positive size
     */
    public Resolution resolutionOf(List<MediaStream> streams) {
        Resolution best = Resolution.UNKNOWN;
        if (streams != null) {
            for (MediaStream stream : streams) {
                if (stream.isVideo() && stream.height() > best.height()) {
                    best = new Resolution(stream.width(), stream.height());
                }
            }
        }
        return best.isKnown() ? best : null;
    }
}
