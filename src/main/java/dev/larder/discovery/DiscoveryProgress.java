package dev.larder.discovery;

import java.util.List;

import dev.larder.provider.DiscoveredRecipeLink;

/**
 * Snapshot of a discovery run. Each snapshot carries the full set of links found so far, not
 * a difference with the previous one.
 *
 * @param phase             DISCOVERING until the terminal snapshot
 * @param recipesFound      number of distinct links found, never decreasing within a run
 * @param categoriesScanned listing pages processed, successfully or not, never decreasing
 * @param totalCategories   listing pages to scan
 * @param complete          true on the terminal snapshot only
 * @param cancelled         true when the run stopped because its signal was cancelled
 * @param recipes           links found so far, in discovery order
 */
public record DiscoveryProgress(
        Phase phase,
        int recipesFound,
        int categoriesScanned,
        int totalCategories,
        boolean complete,
        boolean cancelled,
        List<DiscoveredRecipeLink> recipes
) {

    public DiscoveryProgress {
        recipes = recipes == null ? List.of() : List.copyOf(recipes);
    }

    public enum Phase {
        DISCOVERING,
        COMPLETE
    }
}
