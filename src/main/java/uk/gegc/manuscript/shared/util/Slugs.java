package uk.gegc.manuscript.shared.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Filename-safe slugs: lowercase alphanumeric words joined by hyphens.
 */
public final class Slugs {

    private Slugs() {
    }

    public static String slugify(String text) {
        if (text == null) {
            return "";
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{IsAlphabetic}\\p{IsDigit}]+"))
                .filter(part -> !part.isEmpty())
                .collect(Collectors.joining("-"));
    }

    /**
     * Slug of the given text, or {@code fallback} when the text has no alphanumeric characters.
     */
    public static String slugifyOr(String text, String fallback) {
        String slug = slugify(text);
        return slug.isEmpty() ? fallback : slug;
    }
}
