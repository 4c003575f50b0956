package dev.larder.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.larder.recipe.ImportedIngredient;
import dev.larder.recipe.ReferenceIngredient;
import dev.larder.recipe.ReferenceTag;

/**
 * Validation state of one import batch, created by {@link BatchValidator#initialize}.
 *
 * <p>The unique items, pending lists and exact matches are fixed at construction. Only the
 * mapping tables grow, through {@link BatchValidator#addIngredientMapping} and
 * {@link BatchValidator#addTagMapping}. All maps are keyed by normalized name and keep insertion
 * order. Not thread-safe.
 */
public final class BatchValidationState {

    private final Map<String, ImportedIngredient> uniqueIngredients;
    private final Map<String, String> uniqueTags;
    private final Map<String, ReferenceIngredient> ingredientMappings;
    private final Map<String, ReferenceTag> tagMappings;
    private final List<PendingIngredient> ingredientsToValidate;
    private final List<PendingTag> tagsToValidate;
    private final List<ReferenceIngredient> exactMatchIngredients;
    private final List<ReferenceTag> exactMatchTags;

    BatchValidationState(Map<String, ImportedIngredient> uniqueIngredients,
                         Map<String, String> uniqueTags,
                         Map<String, ReferenceIngredient> ingredientMappings,
                         Map<String, ReferenceTag> tagMappings,
                         List<PendingIngredient> ingredientsToValidate,
                         List<PendingTag> tagsToValidate) {
        this.uniqueIngredients = Collections.unmodifiableMap(new LinkedHashMap<>(uniqueIngredients));
        this.uniqueTags = Collections.unmodifiableMap(new LinkedHashMap<>(uniqueTags));
        this.ingredientMappings = new LinkedHashMap<>(ingredientMappings);
        this.tagMappings = new LinkedHashMap<>(tagMappings);
        this.ingredientsToValidate = List.copyOf(ingredientsToValidate);
        this.tagsToValidate = List.copyOf(tagsToValidate);
        this.exactMatchIngredients = List.copyOf(ingredientMappings.values());
        this.exactMatchTags = List.copyOf(tagMappings.values());
    }

    public Map<String, ImportedIngredient> uniqueIngredients() {
        return uniqueIngredients;
    }

    public Map<String, String> uniqueTags() {
        return uniqueTags;
    }

    public Map<String, ReferenceIngredient> ingredientMappings() {
        return Collections.unmodifiableMap(ingredientMappings);
    }

    public Map<String, ReferenceTag> tagMappings() {
        return Collections.unmodifiableMap(tagMappings);
    }

    /**
     * Ingredients that had no exact match at initialization, those with suggestions first.
     * Resolving an item does not remove it from this list.
     */
    public List<PendingIngredient> ingredientsToValidate() {
        return ingredientsToValidate;
    }

    public List<PendingTag> tagsToValidate() {
        return tagsToValidate;
    }

    public List<ReferenceIngredient> exactMatchIngredients() {
        return exactMatchIngredients;
    }

    public List<ReferenceTag> exactMatchTags() {
        return exactMatchTags;
    }

    void putIngredientMapping(String key, ReferenceIngredient ingredient) {
        ingredientMappings.put(key, ingredient);
    }

    void putTagMapping(String key, ReferenceTag tag) {
        tagMappings.put(key, tag);
    }
}
