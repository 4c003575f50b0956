package dev.larder.api;

import jakarta.validation.constraints.Positive;
import org.jspecify.annotations.Nullable;

/**
 * @param maxRecipes   stop after this many links, null for no limit
 * @param hideImported leave already imported links out of the final link list
 */
public record DiscoveryRequest(@Nullable @Positive Integer maxRecipes, boolean hideImported) {
}
