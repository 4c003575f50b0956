package dev.larder.validation;

import java.util.List;

import dev.larder.recipe.ImportedIngredient;
import dev.larder.recipe.ReferenceIngredient;

/**
 * Imported ingredient without an exact catalog match, waiting for a user decision.
 *
 * @param ingredient  first-seen form of the ingredient in the batch
 * @param suggestions similar catalog ingredients, best first; may be empty
 */
public record PendingIngredient(ImportedIngredient ingredient, List<ReferenceIngredient> suggestions) {

    public PendingIngredient {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public boolean hasSuggestions() {
        return !suggestions.isEmpty();
    }
}
