package com.channelcatalog.generator;

import com.channelcatalog.verifier.Channel;
import com.channelcatalog.verifier.Country;
import com.channelcatalog.verifier.Language;
import com.channelcatalog.verifier.Resolution;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.channelcatalog.generator.SortKey.*;
import static com.channelcatalog.generator.SortKey.Direction.ASC;
import static com.channelcatalog.generator.SortKey.Direction.DESC;
import static org.junit.jupiter.api.Assertions.*;

public class ChannelCollectionTest {

    private static Channel channel(String name, String url, int height, String status) {
        Channel channel = new Channel(name, url);
        channel.setResolution(new Resolution(0, height));
        channel.setStatus(status);
        return channel;
    }

    private static List<String> names(ChannelCollection collection) {
        return collection.get().stream().map(Channel::getName).collect(Collectors.toList());
    }

    @Test
    void testDuplicateSurvivorDependsOnSortOrder() {
        Channel low = channel("News", "http://x/live", 480, null);
        Channel high = channel("News", "http://x/live", 1080, null);
        ChannelCollection collection = new ChannelCollection(List.of(low, high));

        List<Channel> best = collection.sortBy(List.of(RESOLUTION_HEIGHT), List.of(DESC)).removeDuplicates().get();
        assertEquals(List.of(high), best);

        List<Channel> first = collection.removeDuplicates().get();
        assertEquals(List.of(low), first);
    }

    @Test
    void testMultiKeySortWithMissingValuesLowest() {
        ChannelCollection collection = new ChannelCollection(List.of(
            channel("B", "http://b/1", 720, null),
            channel("A", "http://a/2", 0, "Offline"),
            channel("A", "http://a/1", 0, null),
            channel("A", "http://a/3", 1080, null)
        ));

        List<Channel> sorted = collection.sortBy(IndexGenerator.DEFAULT_KEYS, IndexGenerator.DEFAULT_DIRECTIONS).get();

        assertEquals(List.of("http://a/3", "http://a/1", "http://a/2", "http://b/1"),
            sorted.stream().map(Channel::getUrl).collect(Collectors.toList()));
    }

    @Test
    void testSortIsStableAndDefaultsToAscending() {
        ChannelCollection collection = new ChannelCollection(List.of(
            channel("Same", "http://z/1", 0, null),
            channel("Same", "http://a/2", 0, null),
            channel("Other", "http://m/3", 0, null)
        ));
        List<Channel> sorted = collection.sortBy(NAME).get();
        assertEquals(List.of("http://m/3", "http://z/1", "http://a/2"),
            sorted.stream().map(Channel::getUrl).collect(Collectors.toList()));
        assertEquals(List.of("Same", "Same", "Other"), names(collection));
    }

    @Test
    void testStatusFilters() {
        ChannelCollection collection = new ChannelCollection(List.of(
            channel("Up", "http://u/x", 0, null),
            channel("Down", "http://d/x", 0, "Offline"),
            channel("Part", "http://p/x", 0, "Not 24/7"),
            channel("Geo", "http://g/x", 0, "Geo-blocked")
        ));
        assertEquals(List.of("Up", "Part", "Geo"), names(collection.removeOffline()));
        assertEquals(List.of("Down"), names(collection.forStatus("Offline")));
        assertEquals(List.of("Up"), names(collection.forStatus(null)));
        assertEquals(List.of("Up", "Part"), names(collection.onlineOnly()));
    }

    @Test
    void testNsfwFilters() {
        Channel safe = channel("Safe", "http://s/x", 0, null);
        Channel adult = channel("Adult", "http://a/x", 0, null);
        adult.setNsfw(true);
        ChannelCollection collection = new ChannelCollection(List.of(safe, adult));
        assertEquals(List.of(safe), collection.removeNSFW().get());
        assertEquals(List.of(adult), collection.forNsfw(true).get());
    }

    @Test
    void testCountryLanguageAndCategoryPartitions() {
        Channel us = channel("Us", "http://us/x", 0, null);
        us.setCountries(List.of(new Country("us", "United States"), new Country("ca", "Canada")));
        us.setTvgLanguage("English");
        us.setGroupTitle("News");
        Channel nowhere = channel("Nowhere", "http://n/x", 0, null);
        nowhere.setTvgLanguage("Klingon");
        nowhere.setGroupTitle("Lifestyle Extreme");
        ChannelCollection collection = new ChannelCollection(List.of(us, nowhere));

        assertEquals(List.of(us), collection.forCountry(new Country("ca", "Canada")).get());
        assertEquals(List.of(nowhere), collection.forCountry(null).get());
        assertEquals(List.of(us), collection.forLanguage(new Language("eng", "English")).get());
        assertEquals(List.of(nowhere), collection.forLanguage(null).get());
        assertEquals(List.of(us), collection.forCategory(new Category("news", "News")).get());
        assertEquals(List.of(nowhere), collection.forCategory(CategoryRegistry.OTHER).get());
    }

    @Test
    void testViewsAreImmutable() {
        ChannelCollection collection = new ChannelCollection(List.of(channel("A", "http://a/x", 0, null)));
        assertThrows(UnsupportedOperationException.class, () -> collection.get().clear());
        assertEquals(0, collection.filter(c -> false).count());
        assertEquals(1, collection.count());
    }
}
