package dev.larder.discovery;

import java.util.List;

import dev.larder.recipe.ConvertedRecipe;
import org.jspecify.annotations.Nullable;

/**
 * Snapshot of a parsing run.
 *
 * @param phase         PARSING until the terminal snapshot
 * @param current       number of selected links processed so far
 * @param total         number of selected links
 * @param currentTitle  title of the link just processed, null before the first one
 * @param parsedRecipes recipes converted so far, in selection order
 * @param failedRecipes links that failed so far, in selection order
 * @param cancelled     true on the terminal snapshot of a cancelled run
 */
public record ParseProgress(
        Phase phase,
        int current,
        int total,
        @Nullable String currentTitle,
        List<ConvertedRecipe> parsedRecipes,
        List<FailedRecipe> failedRecipes,
        boolean cancelled
) {

    public ParseProgress {
        parsedRecipes = parsedRecipes == null ? List.of() : List.copyOf(parsedRecipes);
        failedRecipes = failedRecipes == null ? List.of() : List.copyOf(failedRecipes);
    }

    public boolean isComplete() {
        return phase == Phase.COMPLETE;
    }

    public enum Phase {
        PARSING,
        COMPLETE
    }
}
