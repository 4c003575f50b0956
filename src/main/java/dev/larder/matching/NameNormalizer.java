package dev.larder.matching;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility class producing the comparison keys used for de-duplication and exact matching of
 * ingredient and tag names.
 */
public final class NameNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern PARENTHETICAL = Pattern.compile("\\s*\\([^)]*\\)");

    private NameNormalizer() {
        // utility class
    }

    /**
     * Normalize a name into its comparison key: trimmed, internal whitespace collapsed to a
     * single space, case-folded.
     *
     * @param name the raw name (may be null)
     * @return the normalized key, empty for null or blank input
     */
    public static String normalizeKey(String name) {
        if (name == null) {
            return "";
        }
        return WHITESPACE.matcher(name.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    /**
     * Strip parenthetical annotations, e.g. {@code "Tomato (canned)"} becomes {@code "Tomato"}.
     * Applied to ingredient names only.
     *
     * @param name the raw ingredient name (may be null)
     * @return the name without parenthesized segments, trimmed
     */
    public static String cleanName(String name) {
        if (name == null) {
            return "";
        }
        return PARENTHETICAL.matcher(name).replaceAll("").trim();
    }

    /**
     * Case-insensitive equality on normalized keys.
     */
    public static boolean sameName(String left, String right) {
        return normalizeKey(left).equals(normalizeKey(right));
    }
}
