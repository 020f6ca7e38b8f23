package com.channelcatalog.verifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;

/**
 * Utility class for the string and URL helpers shared by the verifier and the generator.
 *
 * @author Channel Catalog Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);
    private static final String URI_SAFE = "-._~!$&'()*+,;=:@/?#";

    /**
     * Derives the name part of a tvg-id from a channel name: diacritics are dropped,
     * {@code +} becomes {@code Plus} and everything that is not a letter or digit is removed.
     * @param name channel name
     * @return id, or an empty string if nothing usable remains
     */
    public static String nameToId(String name) {
        if (name == null) return "";
        String ascii = Normalizer.normalize(name, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        return ascii.replace("+", "Plus").replaceAll("[^A-Za-z0-9]+", "");
    }

    /**
     * Strips the leading {@code scheme://} from a URL so mirrors on http and https compare equal.
     */
    public static String removeProtocol(String url) {
        return url == null ? "" : url.replaceFirst("^[A-Za-z][A-Za-z0-9+.-]*://", "");
    }

    /**
     * Returns the host of a URL, or null if the URL cannot be parsed.
     */
    public static String hostOf(String url) {
        if (url == null) return null;
        try {
            String host = toUri(url).getHost();
            return host == null ? null : host.toLowerCase();
        } catch (URISyntaxException e) {
            logger.debug("Unparseable URL '{}': {}", url, e.getMessage());
            return null;
        }
    }

    /**
     * Normalizes a stream URL: lower-cased scheme and host, default ports and fragments dropped,
     * percent-escapes decoded and whitespace replaced with {@code +}. The path and query are kept
     * as-is otherwise. Unparseable URLs are only trimmed and decoded.
     * @param url raw URL from a playlist
     * @return normalized URL
     */
    public static String normalizeUrl(String url) {
        if (url == null) return "";
        String trimmed = url.trim();
        String normalized = trimmed;
        try {
            URI uri = toUri(trimmed);
            if (uri.getScheme() != null && uri.getRawAuthority() != null) {
                String scheme = uri.getScheme().toLowerCase();
                String authority = uri.getRawAuthority();
                int at = authority.lastIndexOf('@');
                String userInfo = at >= 0 ? authority.substring(0, at + 1) : "";
                String hostPort = (at >= 0 ? authority.substring(at + 1) : authority).toLowerCase();
                if (("http".equals(scheme) && hostPort.endsWith(":80")) || ("https".equals(scheme) && hostPort.endsWith(":443"))) {
                    hostPort = hostPort.substring(0, hostPort.lastIndexOf(':'));
                }
                String path = uri.getRawPath() == null ? "" : uri.getRawPath();
                String query = uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery();
                normalized = scheme + "://" + userInfo + hostPort + path + query;
            }
        } catch (URISyntaxException e) {
            logger.debug("Keeping URL '{}' unnormalized: {}", url, e.getMessage());
        }
        return decode(normalized).replaceAll("\\s", "+");
    }

    /**
     * Parses a URL that may hold characters {@link URI} rejects, such as the {@code |} or {@code "}
     * left behind by {@link #normalizeUrl}. Such characters are percent-encoded again; valid
     * escapes are kept.
     * @param url URL, possibly decoded
     * @return parsed URI
     * @throws URISyntaxException if the URL cannot be parsed even after escaping
     */
    public static URI toUri(String url) throws URISyntaxException {
        if (url == null) throw new URISyntaxException("null", "URL is null");
        String trimmed = url.trim();
        try {
            return new URI(trimmed);
        } catch (URISyntaxException e) {
            return new URI(escapeIllegal(trimmed));
        }
    }

    static String escapeIllegal(String url) {
        // Brackets are legal only around an IPv6 host.
        int authorityEnd = url.length();
        int scheme = url.indexOf("://");
        if (scheme >= 0) {
            for (int i = scheme + 3; i < url.length(); i++) {
                char c = url.charAt(i);
                if (c == '/' || c == '?' || c == '#') {
                    authorityEnd = i;
                    break;
                }
            }
        }
        StringBuilder sb = new StringBuilder(url.length() + 16);
        for (int i = 0; i < url.length(); ) {
            int cp = url.codePointAt(i);
            int next = i + Character.charCount(cp);
            if (cp == '%' && i + 2 < url.length() && isHex(url.charAt(i + 1)) && isHex(url.charAt(i + 2))) {
                sb.append('%');
            } else if (cp < 0x80 && (Character.isLetterOrDigit(cp) || URI_SAFE.indexOf(cp) >= 0)) {
                sb.append((char) cp);
            } else if ((cp == '[' || cp == ']') && i < authorityEnd) {
                sb.append((char) cp);
            } else {
                for (byte b : new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8)) {
                    sb.append('%').append(Character.toUpperCase(Character.forDigit((b >> 4) & 0xF, 16)))
                        .append(Character.toUpperCase(Character.forDigit(b & 0xF, 16)));
                }
            }
            i = next;
        }
        return sb.toString();
    }

    private static boolean isHex(char c) {
        return Character.digit(c, 16) >= 0;
    }

    private static String decode(String url) {
        try {
            // URLDecoder turns '+' into a space; protect literal pluses first.
            return URLDecoder.decode(url.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return url;
        }
    }

    /**
     * Returns true for null or blank strings.
     */
    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * Sanitizes a value for an M3U attribute: double quotes and line breaks are removed.
     */
    public static String sanitizeAttribute(String value) {
        return value == null ? "" : value.replace("\"", "").replaceAll("[\\r\\n]+", " ").trim();
    }
}
