package dev.larder.matching;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of a fuzzy search. When {@code exact} is present, {@code similar} is always empty.
 *
 * @param exact   the item whose normalized key equals the query, if any
 * @param similar items within the match level threshold, best first
 * @param <T>     the searched item type
 */
public record FuzzySearchResult<T>(@Nullable T exact, List<T> similar) {

    public FuzzySearchResult {
        similar = similar == null ? List.of() : List.copyOf(similar);
        if (exact != null && !similar.isEmpty()) {
            throw new IllegalArgumentException("An exact match excludes similar candidates");
        }
    }

    public static <T> FuzzySearchResult<T> exactMatch(T item) {
        return new FuzzySearchResult<>(item, List.of());
    }

    public static <T> FuzzySearchResult<T> similarTo(List<T> items) {
        return new FuzzySearchResult<>(null, items);
    }

    public static <T> FuzzySearchResult<T> none() {
        return new FuzzySearchResult<>(null, List.of());
    }

    public boolean hasExact() {
        return exact != null;
    }

    /**
     * The exact match as a single-element list, otherwise the similar candidates.
     */
    public List<T> candidates() {
        return exact != null ? List.of(exact) : similar;
    }
}
