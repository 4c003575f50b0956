package dev.larder.discovery;

import java.util.function.BiConsumer;

import dev.larder.fetch.CancellationSignal;
import org.jspecify.annotations.Nullable;

/**
 * Parameters of one discovery run.
 *
 * @param maxRecipes    stop once this many links are found, null for no limit
 * @param signal        cancellation for the run and its image enrichment
 * @param onImageLoaded receives {@code (recipeUrl, imageUrl)} pairs found after the run, null to
 *                      skip image enrichment
 */
public record DiscoveryOptions(
        @Nullable Integer maxRecipes,
        CancellationSignal signal,
        @Nullable BiConsumer<String, String> onImageLoaded
) {

    public DiscoveryOptions {
        if (maxRecipes != null && maxRecipes < 1) {
            throw new IllegalArgumentException("maxRecipes must be positive, got " + maxRecipes);
        }
        signal = signal == null ? CancellationSignal.none() : signal;
    }

    public static DiscoveryOptions unlimited(CancellationSignal signal) {
        return new DiscoveryOptions(null, signal, null);
    }
}
