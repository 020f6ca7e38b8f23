package com.channelcatalog.verifier;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structured reason attached to a failed probe.
 * <p>
 * Probers that only report free text (e.g. wrapped command-line checkers) go through
 * {@link #fromText(String)}, which keeps the distinctions the classifier relies on.
 */
public enum FailureReason {
    /** The request or stream read did not finish within the configured timeout. */
    TIMEOUT,
    /** The server answered 403. */
    FORBIDDEN,
    /** The server answered a 4xx code other than 400, 401, 403 or 404 (e.g. 402, 451). */
    UNEXPECTED_CLIENT_ERROR,
    /** Anything else: DNS failures, refused connections, 5xx, unreadable media. */
    OTHER;

    private static final Set<Integer> EXPECTED_CLIENT_ERRORS = Set.of(400, 401, 403, 404);
    private static final Pattern STATUS_CODE = Pattern.compile("\\b(4\\d\\d)\\b");

    /**
     * Maps an HTTP status code of a failed response to a reason.
     * @param statusCode HTTP status code (non-2xx)
     * @return matching reason
     */
    public static FailureReason fromStatusCode(int statusCode) {
        if (statusCode == 403) return FORBIDDEN;
        if (statusCode >= 400 && statusCode < 500 && !EXPECTED_CLIENT_ERRORS.contains(statusCode)) {
            return UNEXPECTED_CLIENT_ERROR;
        }
        return OTHER;
    }

    /**
     * Maps a free-text failure message to a reason. Checks run in priority order:
     * time-out, 403, other unexpected 4xx, anything else.
     * @param text failure message, may be null
     * @return matching reason, {@link #OTHER} when nothing matches
     */
    public static FailureReason fromText(String text) {
        if (text == null || text.isBlank()) return OTHER;
        String lower = text.toLowerCase();
        if (lower.contains("timed out") || lower.contains("timeout")) return TIMEOUT;
        if (lower.contains("403")) return FORBIDDEN;
        if (lower.contains("not one of 40{0,1,3,4}")) return UNEXPECTED_CLIENT_ERROR;
        Matcher m = STATUS_CODE.matcher(lower);
        while (m.find()) {
            if (fromStatusCode(Integer.parseInt(m.group(1))) == UNEXPECTED_CLIENT_ERROR) {
                return UNEXPECTED_CLIENT_ERROR;
            }
        }
        return OTHER;
    }
}
