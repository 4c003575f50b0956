package dev.larder.matching;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Threshold-based fuzzy search over a list of named items.
 *
 * <p>Search runs in two steps:
 * <ol>
 *   <li>exact match on {@link NameNormalizer#normalizeKey normalized keys}; when found, no
 *       similarity search is performed, at every {@link MatchLevel}</li>
 *   <li>approximate substring scoring: the fewest edits needed to align the query with any
 *       substring of the item key, relative to the query length, plus a small penalty for
 *       matches starting further into the key</li>
 * </ol>
 *
 * <p>Scores range from 0 (identical) to 1 (unrelated). Candidates scoring at or below the level
 * threshold are returned best first; ties keep their input order.
 */
public final class FuzzyMatcher {

    /** Characters of offset that cost a full score point (proximity weighting). */
    private static final double LOCATION_DISTANCE = 100.0;

    private FuzzyMatcher() {
        // utility class
    }

    /**
     * Search {@code items} for {@code query}.
     *
     * @param items the candidate items, not mutated
     * @param query the raw query text
     * @param keyOf extracts the comparable name of an item
     * @param level strictness of the similarity step
     * @param <T>   item type
     * @return exact match, or similar items within threshold, or neither
     */
    public static <T> FuzzySearchResult<T> search(List<T> items, String query,
                                                  Function<T, String> keyOf, MatchLevel level) {
        if (items == null || items.isEmpty() || query == null || query.isBlank()) {
            return FuzzySearchResult.none();
        }

        String normalizedQuery = NameNormalizer.normalizeKey(query);
        for (T item : items) {
            if (NameNormalizer.normalizeKey(keyOf.apply(item)).equals(normalizedQuery)) {
                return FuzzySearchResult.exactMatch(item);
            }
        }

        List<Scored<T>> scored = new ArrayList<>();
        for (T item : items) {
            double score = score(normalizedQuery, NameNormalizer.normalizeKey(keyOf.apply(item)));
            if (score <= level.threshold()) {
                scored.add(new Scored<>(item, score));
            }
        }
        // List.sort is stable: equal scores keep input order
        scored.sort(Comparator.comparingDouble(Scored::score));
        return FuzzySearchResult.similarTo(scored.stream().map(Scored::item).toList());
    }

    /**
     * Dissimilarity score between a normalized pattern and a normalized text.
     *
     * @param pattern the normalized query
     * @param text    the normalized item key
     * @return score in [0, 1], 0 meaning the pattern occurs verbatim at the start of the text
     */
    static double score(String pattern, String text) {
        if (pattern.isEmpty()) {
            return 1.0;
        }
        if (text.isEmpty()) {
            return 1.0;
        }

        int m = pattern.length();
        int n = text.length();

        // previous[j]: fewest edits aligning pattern[0..i) with a substring of text ending at j
        int[] previous = new int[n + 1];
        int[] current = new int[n + 1];
        // start[j]: where the best alignment ending at j begins in text
        int[] previousStart = new int[n + 1];
        int[] currentStart = new int[n + 1];
        for (int j = 0; j <= n; j++) {
            previous[j] = 0;
            previousStart[j] = j;
        }

        for (int i = 1; i <= m; i++) {
            current[0] = i;
            currentStart[0] = 0;
            char p = pattern.charAt(i - 1);
            for (int j = 1; j <= n; j++) {
                int substitution = previous[j - 1] + (p == text.charAt(j - 1) ? 0 : 1);
                int deletion = previous[j] + 1;
                int insertion = current[j - 1] + 1;

                int best = substitution;
                int bestStart = previousStart[j - 1];
                if (deletion < best) {
                    best = deletion;
                    bestStart = previousStart[j];
                }
                if (insertion < best) {
                    best = insertion;
                    bestStart = currentStart[j - 1];
                }
                current[j] = best;
                currentStart[j] = bestStart;
            }
            int[] swap = previous;
            previous = current;
            current = swap;
            int[] swapStart = previousStart;
            previousStart = currentStart;
            currentStart = swapStart;
        }

        double bestScore = 1.0;
        for (int j = 1; j <= n; j++) {
            double accuracy = (double) previous[j] / m;
            double proximity = previousStart[j] / LOCATION_DISTANCE;
            double candidate = Math.min(1.0, accuracy + proximity);
            if (candidate < bestScore) {
                bestScore = candidate;
            }
        }
        return bestScore;
    }

    private record Scored<T>(T item, double score) {}
}
