package com.channelcatalog.verifier;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One playlist entry.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Created by {@link M3uPlaylistCodec} from an {@code #EXTINF} block; the codec also decides the NSFW flag.</li>
 *   <li>Mutated in place by {@link MetadataEnricher}, {@link StatusClassifier} and {@link OriginCanonicalizer} during a verification pass.</li>
 *   <li>Read-only for the generator, which renders it with an optional group-title override.</li>
 * </ul>
 * Empty attributes are held as empty strings, never null; only {@code status} may be null
 * ("verified, nothing to report").
 *
 * @author Channel Catalog Team
 * @since 1.0
 */
public class Channel {
    private String name = "";
    private String url = "";
    private String tvgId = "";
    private String tvgName = "";
    private String tvgLanguage = "";
    private String tvgCountry = "";
    private String tvgUrl = "";
    private String logo = "";
    private String groupTitle = "";
    private String category = "";
    private String status;
    private Resolution resolution = Resolution.UNKNOWN;
    private List<Country> countries = new ArrayList<>();
    private String httpReferrer = "";
    private String userAgent = "";
    private boolean nsfw;

    public Channel() {}

    public Channel(String name, String url) {
        setName(name);
        setUrl(url);
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = nz(name); }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = nz(url); }

    public String getTvgId() { return tvgId; }
    public void setTvgId(String tvgId) { this.tvgId = nz(tvgId); }

    public String getTvgName() { return tvgName; }
    public void setTvgName(String tvgName) { this.tvgName = nz(tvgName); }

    public String getTvgLanguage() { return tvgLanguage; }
    public void setTvgLanguage(String tvgLanguage) { this.tvgLanguage = nz(tvgLanguage); }

    public String getTvgCountry() { return tvgCountry; }
    public void setTvgCountry(String tvgCountry) { this.tvgCountry = nz(tvgCountry); }

    public String getTvgUrl() { return tvgUrl; }
    public void setTvgUrl(String tvgUrl) { this.tvgUrl = nz(tvgUrl); }

    public String getLogo() { return logo; }
    public void setLogo(String logo) { this.logo = nz(logo); }

    public String getGroupTitle() { return groupTitle; }
    public void setGroupTitle(String groupTitle) { this.groupTitle = nz(groupTitle); }

    /** Free-text category hint carried by an {@code #EXTGRP} line. */
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = nz(category); }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status == null || status.isBlank() ? null : status; }

    public Resolution getResolution() { return resolution; }
    public void setResolution(Resolution resolution) { this.resolution = resolution == null ? Resolution.UNKNOWN : resolution; }

    public List<Country> getCountries() { return countries; }

    /**
     * Replaces the country associations and keeps the {@code tvg-country} attribute in sync.
     */
    public void setCountries(List<Country> countries) {
        this.countries = countries == null ? new ArrayList<>() : new ArrayList<>(countries);
        this.tvgCountry = this.countries.stream().map(c -> c.code().toUpperCase()).collect(Collectors.joining(";"));
    }

    public String getHttpReferrer() { return httpReferrer; }
    public void setHttpReferrer(String httpReferrer) { this.httpReferrer = nz(httpReferrer); }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = nz(userAgent); }

    public boolean isNsfw() { return nsfw; }
    public void setNsfw(boolean nsfw) { this.nsfw = nsfw; }

    /**
     * Languages named by {@code tvg-language} that the registry knows about.
     */
    public List<Language> getLanguages() {
        return LanguageRegistry.fromNames(tvgLanguage);
    }

    /**
     * Category partition key: the lower-cased group title.
     */
    public String getCategoryId() {
        return groupTitle.toLowerCase();
    }

    public boolean isOffline() {
        return ChannelStatus.OFFLINE.matches(status);
    }

    /**
     * Display title as written after the {@code #EXTINF} comma, e.g. {@code News 24 (720p) [Not 24/7]}.
     */
    public String getTitle() {
        StringBuilder sb = new StringBuilder(name);
        if (resolution.height() > 0) sb.append(" (").append(resolution.height()).append("p)");
        if (status != null) sb.append(" [").append(status).append(']');
        return sb.toString();
    }

    /**
     * Renders the entry as M3U lines using the channel's own group title.
     */
    public String toM3u() {
        return toM3u(groupTitle);
    }

    /**
     * Renders the entry as M3U lines, replacing the group title for this rendering only.
     * @param groupOverride group title to write
     * @return {@code #EXTINF} line, optional {@code #EXTVLCOPT} lines and the URL, newline-terminated
     */
    public String toM3u(String groupOverride) {
        StringBuilder sb = new StringBuilder("#EXTINF:-1");
        sb.append(" tvg-id=\"").append(Utils.sanitizeAttribute(tvgId)).append('"');
        sb.append(" tvg-name=\"").append(Utils.sanitizeAttribute(tvgName)).append('"');
        sb.append(" tvg-country=\"").append(Utils.sanitizeAttribute(tvgCountry)).append('"');
        sb.append(" tvg-language=\"").append(Utils.sanitizeAttribute(tvgLanguage)).append('"');
        sb.append(" tvg-logo=\"").append(Utils.sanitizeAttribute(logo)).append('"');
        if (!tvgUrl.isEmpty()) sb.append(" tvg-url=\"").append(Utils.sanitizeAttribute(tvgUrl)).append('"');
        sb.append(" group-title=\"").append(Utils.sanitizeAttribute(groupOverride)).append('"');
        sb.append(',').append(getTitle()).append('\n');
        if (!category.isEmpty()) sb.append("#EXTGRP:").append(category).append('\n');
        if (!httpReferrer.isEmpty()) sb.append("#EXTVLCOPT:http-referrer=").append(httpReferrer).append('\n');
        if (!userAgent.isEmpty()) sb.append("#EXTVLCOPT:http-user-agent=").append(userAgent).append('\n');
        sb.append(url).append('\n');
        return sb.toString();
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }

    @Override
    public String toString() {
        return "Channel{" + name + ", " + url + "}";
    }
}
