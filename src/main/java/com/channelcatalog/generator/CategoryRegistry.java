package com.channelcatalog.generator;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fixed list of categories that get their own output playlist. Channels whose group title is not
 * one of these land in {@link #OTHER}.
 */
public final class CategoryRegistry {
    private CategoryRegistry() {}

    public static final Category OTHER = new Category("other", "Other");

    private static final List<Category> CATEGORIES = List.of(
        new Category("auto", "Auto"),
        new Category("animation", "Animation"),
        new Category("business", "Business"),
        new Category("classic", "Classic"),
        new Category("comedy", "Comedy"),
        new Category("cooking", "Cooking"),
        new Category("culture", "Culture"),
        new Category("documentary", "Documentary"),
        new Category("education", "Education"),
        new Category("entertainment", "Entertainment"),
        new Category("family", "Family"),
        new Category("general", "General"),
        new Category("kids", "Kids"),
        new Category("legislative", "Legislative"),
        new Category("lifestyle", "Lifestyle"),
        new Category("local", "Local"),
        new Category("movies", "Movies"),
        new Category("music", "Music"),
        new Category("news", "News"),
        new Category("outdoor", "Outdoor"),
        new Category("relax", "Relax"),
        new Category("religious", "Religious"),
        new Category("science", "Science"),
        new Category("series", "Series"),
        new Category("shop", "Shop"),
        new Category("sports", "Sports"),
        new Category("travel", "Travel"),
        new Category("weather", "Weather"),
        new Category("xxx", "XXX")
    );

    private static final Set<String> IDS = CATEGORIES.stream().map(Category::id).collect(Collectors.toUnmodifiableSet());

    public static List<Category> getCategories() {
        return CATEGORIES;
    }

    public static boolean isKnown(String id) {
        return id != null && IDS.contains(id);
    }
}
