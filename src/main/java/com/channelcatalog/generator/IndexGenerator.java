package com.channelcatalog.generator;

import com.channelcatalog.verifier.Channel;
import com.channelcatalog.verifier.Country;
import com.channelcatalog.verifier.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.channelcatalog.generator.SortKey.*;
import static com.channelcatalog.generator.SortKey.Direction.ASC;
import static com.channelcatalog.generator.SortKey.Direction.DESC;

/**
 * Regenerates every output playlist from a verified {@link Catalog}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Each output is one composed {@link ChannelCollection} query: sort by name, status,
 *       descending height and URL (partitioned indexes sort by their partition key first),
 *       then filter, dedup and exclude.</li>
 *   <li>Master and category outputs keep NSFW channels and drop offline ones; the master index is
 *       written twice, with and without NSFW entries.</li>
 *   <li>Country and language outputs drop both NSFW and offline channels.</li>
 *   <li>Every M3U file starts with {@code #EXTM3U url-tvg="..."} listing the sorted, distinct guide URLs of its entries.</li>
 * </ul>
 * The catalog is never modified; partition names are applied as a group-title override at render time.
 *
 * @author Channel Catalog Team
 * @since 1.0
 */
public class IndexGenerator {
    private static final Logger logger = LoggerFactory.getLogger(IndexGenerator.class);

    static final List<SortKey> DEFAULT_KEYS = List.of(NAME, STATUS, RESOLUTION_HEIGHT, URL);
    static final List<SortKey.Direction> DEFAULT_DIRECTIONS = List.of(ASC, ASC, DESC, ASC);

    private final Path rootDir;
    private final ChannelJsonExporter jsonExporter = new ChannelJsonExporter();

    public IndexGenerator(Path rootDir) {
        if (rootDir == null) throw new IllegalArgumentException("Output directory cannot be null");
        this.rootDir = rootDir;
    }

    /**
     * Writes every output of the catalog.
     * @param catalog verified catalog
     * @throws IOException if an output cannot be written
     */
    public void generate(Catalog catalog) throws IOException {
        Files.createDirectories(rootDir);
        Files.writeString(rootDir.resolve(".nojekyll"), "");
        generateIndex(catalog);
        generateCategoryIndex(catalog);
        generateCountryIndex(catalog);
        generateLanguageIndex(catalog);
        generateCategories(catalog);
        generateCountries(catalog);
        generateLanguages(catalog);
        generateChannelsJson(catalog);
        logger.info("Total: {} channels, {} countries, {} languages, {} categories.",
            catalog.channels().count(), catalog.countries().size(), catalog.languages().size(), catalog.categories().size());
    }

    static ChannelCollection sorted(ChannelCollection channels) {
        return channels.sortBy(DEFAULT_KEYS, DEFAULT_DIRECTIONS);
    }

    void generateIndex(Catalog catalog) throws IOException {
        logger.info("Generating index.m3u...");
        List<Channel> channels = sorted(catalog.channels())
            .removeDuplicates()
            .removeOffline()
            .get();
        String header = header(channels);

        StringBuilder safe = new StringBuilder(header);
        StringBuilder nsfw = new StringBuilder(header);
        for (Channel channel : channels) {
            if (!channel.isNsfw()) safe.append(channel.toM3u());
            nsfw.append(channel.toM3u());
        }
        write(rootDir.resolve("index.m3u"), safe.toString());
        write(rootDir.resolve("index.nsfw.m3u"), nsfw.toString());
    }

    void generateCategoryIndex(Catalog catalog) throws IOException {
        logger.info("Generating index.category.m3u...");
        List<Channel> channels = catalog.channels()
            .sortBy(List.of(CATEGORY, NAME, STATUS, RESOLUTION_HEIGHT, URL), List.of(ASC, ASC, ASC, DESC, ASC))
            .removeDuplicates()
            .removeOffline()
            .get();
        write(rootDir.resolve("index.category.m3u"), render(channels));
    }

    void generateCountryIndex(Catalog catalog) throws IOException {
        logger.info("Generating index.country.m3u...");
        List<Country> partitions = new ArrayList<>();
        partitions.add(null);
        partitions.addAll(catalog.countries());

        List<Channel> all = new ArrayList<>();
        StringBuilder body = new StringBuilder();
        for (Country country : partitions) {
            List<Channel> channels = sorted(catalog.channels())
                .forCountry(country)
                .removeDuplicates()
                .removeNSFW()
                .removeOffline()
                .get();
            String group = country == null ? "" : country.name();
            for (Channel channel : channels) {
                body.append(channel.toM3u(group));
            }
            all.addAll(channels);
        }
        write(rootDir.resolve("index.country.m3u"), header(all) + body);
    }

    void generateLanguageIndex(Catalog catalog) throws IOException {
        logger.info("Generating index.language.m3u...");
        List<Language> partitions = new ArrayList<>();
        partitions.add(null);
        partitions.addAll(catalog.languages());

        List<Channel> all = new ArrayList<>();
        StringBuilder body = new StringBuilder();
        for (Language language : partitions) {
            List<Channel> channels = sorted(catalog.channels())
                .forLanguage(language)
                .removeDuplicates()
                .removeNSFW()
                .removeOffline()
                .get();
            String group = language == null ? "" : language.name();
            for (Channel channel : channels) {
                body.append(channel.toM3u(group));
            }
            all.addAll(channels);
        }
        write(rootDir.resolve("index.language.m3u"), header(all) + body);
    }

    void generateCategories(Catalog catalog) throws IOException {
        logger.info("Generating /categories...");
        Path outputDir = rootDir.resolve("categories");
        Files.createDirectories(outputDir);

        List<Category> categories = new ArrayList<>(catalog.categories());
        categories.add(CategoryRegistry.OTHER);
        for (Category category : categories) {
            List<Channel> channels = sorted(catalog.channels())
                .forCategory(category)
                .removeDuplicates()
                .removeOffline()
                .get();
            write(outputDir.resolve(category.id() + ".m3u"), render(channels));
        }
    }

    void generateCountries(Catalog catalog) throws IOException {
        logger.info("Generating /countries...");
        Path outputDir = rootDir.resolve("countries");
        Files.createDirectories(outputDir);

        List<Country> countries = new ArrayList<>(catalog.countries());
        countries.add(null);
        for (Country country : countries) {
            List<Channel> channels = sorted(catalog.channels())
                .forCountry(country)
                .removeDuplicates()
                .removeOffline()
                .removeNSFW()
                .get();
            String code = country == null ? "undefined" : country.code();
            write(outputDir.resolve(code + ".m3u"), render(channels));
        }
    }

    void generateLanguages(Catalog catalog) throws IOException {
        logger.info("Generating /languages...");
        Path outputDir = rootDir.resolve("languages");
        Files.createDirectories(outputDir);

        List<Language> languages = new ArrayList<>(catalog.languages());
        languages.add(null);
        for (Language language : languages) {
            List<Channel> channels = sorted(catalog.channels())
                .forLanguage(language)
                .removeDuplicates()
                .removeOffline()
                .removeNSFW()
                .get();
            String code = language == null ? "undefined" : language.code();
            write(outputDir.resolve(code + ".m3u"), render(channels));
        }
    }

    void generateChannelsJson(Catalog catalog) throws IOException {
        logger.info("Generating channels.json...");
        List<Channel> channels = sorted(catalog.channels()).get();
        write(rootDir.resolve("channels.json"), jsonExporter.export(channels));
    }

    private static String render(List<Channel> channels) {
        StringBuilder sb = new StringBuilder(header(channels));
        for (Channel channel : channels) {
            sb.append(channel.toM3u());
        }
        return sb.toString();
    }

    static String header(Collection<Channel> channels) {
        return "#EXTM3U url-tvg=\"" + urlTvg(channels.stream().map(Channel::getTvgUrl).collect(Collectors.toList())) + "\"\n";
    }

    /**
     * Joins guide URLs for a playlist header: blanks dropped, duplicates removed, sorted, comma-separated.
     */
    static String urlTvg(List<String> guides) {
        return guides.stream()
            .filter(Objects::nonNull)
            .filter(g -> !g.isEmpty())
            .distinct()
            .sorted()
            .collect(Collectors.joining(","));
    }

    private static void write(Path file, String content) throws IOException {
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }
}
