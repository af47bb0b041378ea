package dev.ebullient.gamemaster;

public class StringUtils {
    /**
     * Convert a display name into an identifier-safe slug: lowercase, runs of
     * anything else collapsed to a single underscore.
     */
    public static String slugify(String text) {
        if (text == null || text.isBlank()) {
            return "unnamed";
        }
        String slug = text.toLowerCase()
                .replaceAll("[^a-z0-9]+", "_") // Replace anything else with underscores
                .replaceAll("^_+|_+$", ""); // Remove leading/trailing underscores
        return slug.isEmpty() ? "unnamed" : slug;
    }

    public static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        return fallback;
    }
}
