package com.channelcatalog.verifier;

import java.util.List;

/**
 * Fills empty channel metadata from the channel itself and from reference data.
 * <p>
 * Steps run in a fixed order and only ever fill empty fields:
 * <ol>
 *   <li>tvg-name from the display name, quotes stripped</li>
 *   <li>tvg-id from the tvg-name plus the playlist country code</li>
 *   <li>countries from the tvg-id suffix</li>
 *   <li>logo: reference channel, then EPG code</li>
 *   <li>tvg-language: reference channel languages, then the first country's default language</li>
 *   <li>group-title: category hint, then reference category, then empty</li>
 * </ol>
 *
 * @author Channel Catalog Team
 * @since 1.0
 */
public class MetadataEnricher {

    /**
     * Enriches a channel in place.
     * @param channel channel to update
     * @param countryCode playlist default country code
     * @param reference reference maps for this run
     */
    public void enrich(Channel channel, String countryCode, ReferenceData reference) {
        updateTvgName(channel);
        updateTvgId(channel, countryCode);
        updateCountries(channel);

        ReferenceChannel data = reference.channel(channel.getTvgId());
        EpgCode epgData = reference.code(channel.getTvgId());
        updateLogo(channel, data, epgData);
        updateLanguage(channel, data);
        updateGroupTitle(channel, data);
    }

    void updateTvgName(Channel channel) {
        if (channel.getTvgName().isEmpty()) {
            channel.setTvgName(channel.getName().replace("\"", ""));
        }
    }

    void updateTvgId(Channel channel, String countryCode) {
        if (channel.getTvgId().isEmpty() && !channel.getTvgName().isEmpty()) {
            String id = Utils.nameToId(channel.getTvgName());
            channel.setTvgId(id.isEmpty() ? "" : id + "." + countryCode);
        }
    }

    void updateCountries(Channel channel) {
        if (!channel.getCountries().isEmpty() || channel.getTvgId().isEmpty()) return;
        String[] parts = channel.getTvgId().split("\\.");
        String code = parts.length > 1 ? parts[1] : null;
        Country country = CountryRegistry.byCode(code);
        if (country != null) channel.setCountries(List.of(country));
    }

    void updateLogo(Channel channel, ReferenceChannel data, EpgCode epgData) {
        if (!channel.getLogo().isEmpty()) return;
        if (data != null && !data.logo().isEmpty()) {
            channel.setLogo(data.logo());
        } else if (epgData != null && !epgData.logo().isEmpty()) {
            channel.setLogo(epgData.logo());
        }
    }

    void updateLanguage(Channel channel, ReferenceChannel data) {
        if (!channel.getTvgLanguage().isEmpty()) return;
        if (data != null && !data.languages().isEmpty()) {
            channel.setTvgLanguage(String.join(";", data.languages()));
        } else if (!channel.getCountries().isEmpty()) {
            channel.setTvgLanguage(CountryRegistry.countryToLanguage(channel.getCountries().get(0).code()));
        }
    }

    void updateGroupTitle(Channel channel, ReferenceChannel data) {
        if (!channel.getGroupTitle().isEmpty()) return;
        if (!channel.getCategory().isEmpty()) {
            channel.setGroupTitle(channel.getCategory());
        } else if (data != null && !data.category().isEmpty()) {
            channel.setGroupTitle(data.category());
        } else {
            channel.setGroupTitle("");
        }
    }
}
