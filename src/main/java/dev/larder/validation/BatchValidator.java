package dev.larder.validation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dev.larder.matching.FuzzyMatcher;
import dev.larder.matching.FuzzySearchResult;
import dev.larder.matching.MatchLevel;
import dev.larder.matching.NameNormalizer;
import dev.larder.recipe.ConvertedRecipe;
import dev.larder.recipe.ImportedIngredient;
import dev.larder.recipe.ReferenceIngredient;
import dev.larder.recipe.ReferenceTag;
import dev.larder.recipe.ValidatedRecipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reconciles the ingredients and tags of a recipe batch with the reference catalog.
 *
 * <p>Each distinct ingredient and tag is looked up once for the whole batch. Exact matches are
 * mapped automatically; the others are listed for the user, who resolves them one by one. The
 * resulting mapping table is then applied to every recipe of the batch.
 *
 * <p>Ingredients are matched at {@link MatchLevel#PERMISSIVE} on their names without
 * parenthetical annotations, since quantity and unit still come from the import. Tags are matched
 * at {@link MatchLevel#MODERATE}: a wrong tag would only add noise.
 */
@Component
public class BatchValidator {

    private static final Logger log = LoggerFactory.getLogger(BatchValidator.class);

    /**
     * Build the validation state of a batch.
     *
     * @param recipes              recipes of the batch
     * @param referenceIngredients catalog ingredients, not modified
     * @param referenceTags        catalog tags, not modified
     * @return the new state, with exact matches already mapped
     */
    public BatchValidationState initialize(List<ConvertedRecipe> recipes,
                                           List<ReferenceIngredient> referenceIngredients,
                                           List<ReferenceTag> referenceTags) {
        Map<String, ImportedIngredient> uniqueIngredients = collectUniqueIngredients(recipes);
        Map<String, String> uniqueTags = collectUniqueTags(recipes);

        Map<String, ReferenceIngredient> ingredientMappings = new LinkedHashMap<>();
        List<PendingIngredient> withSuggestions = new ArrayList<>();
        List<PendingIngredient> withoutSuggestions = new ArrayList<>();
        for (Map.Entry<String, ImportedIngredient> entry : uniqueIngredients.entrySet()) {
            ImportedIngredient ingredient = entry.getValue();
            FuzzySearchResult<ReferenceIngredient> result = FuzzyMatcher.search(
                    referenceIngredients,
                    NameNormalizer.cleanName(ingredient.name()),
                    reference -> NameNormalizer.cleanName(reference.name()),
                    MatchLevel.PERMISSIVE);
            if (result.hasExact()) {
                ingredientMappings.put(entry.getKey(), mergeAmount(result.exact(), ingredient));
            } else if (result.similar().isEmpty()) {
                withoutSuggestions.add(new PendingIngredient(ingredient, List.of()));
            } else {
                withSuggestions.add(new PendingIngredient(ingredient, result.similar()));
            }
        }

        Map<String, ReferenceTag> tagMappings = new LinkedHashMap<>();
        List<PendingTag> tagsWithSuggestions = new ArrayList<>();
        List<PendingTag> tagsWithoutSuggestions = new ArrayList<>();
        for (Map.Entry<String, String> entry : uniqueTags.entrySet()) {
            FuzzySearchResult<ReferenceTag> result = FuzzyMatcher.search(
                    referenceTags, entry.getValue(), ReferenceTag::name, MatchLevel.MODERATE);
            if (result.hasExact()) {
                tagMappings.put(entry.getKey(), result.exact());
            } else if (result.similar().isEmpty()) {
                tagsWithoutSuggestions.add(new PendingTag(entry.getValue(), List.of()));
            } else {
                tagsWithSuggestions.add(new PendingTag(entry.getValue(), result.similar()));
            }
        }

        List<PendingIngredient> ingredientsToValidate = new ArrayList<>(withSuggestions);
        ingredientsToValidate.addAll(withoutSuggestions);
        List<PendingTag> tagsToValidate = new ArrayList<>(tagsWithSuggestions);
        tagsToValidate.addAll(tagsWithoutSuggestions);

        log.info("Batch of {} recipes: {} ingredients ({} exact), {} tags ({} exact)",
                recipes.size(), uniqueIngredients.size(), ingredientMappings.size(),
                uniqueTags.size(), tagMappings.size());
        return new BatchValidationState(uniqueIngredients, uniqueTags, ingredientMappings, tagMappings,
                ingredientsToValidate, tagsToValidate);
    }

    /**
     * Map an imported ingredient name to a catalog ingredient, replacing any previous mapping.
     */
    public void addIngredientMapping(BatchValidationState state, String originalName, ReferenceIngredient resolved) {
        state.putIngredientMapping(ingredientKey(originalName), resolved);
    }

    /**
     * Map an imported tag name to a catalog tag, replacing any previous mapping.
     */
    public void addTagMapping(BatchValidationState state, String originalName, ReferenceTag resolved) {
        state.putTagMapping(tagKey(originalName), resolved);
    }

    /**
     * Replace every ingredient and tag of the recipes with its mapped catalog item. Items without
     * a mapping are left out. Recipes may end up without ingredients; filtering them is up to the
     * caller.
     *
     * @param recipes recipes of the batch
     * @param state   validation state of the batch
     * @return one validated recipe per input recipe, in order
     */
    public List<ValidatedRecipe> applyMappingsToRecipes(List<ConvertedRecipe> recipes, BatchValidationState state) {
        List<ValidatedRecipe> validated = new ArrayList<>(recipes.size());
        for (ConvertedRecipe recipe : recipes) {
            List<ReferenceIngredient> ingredients = new ArrayList<>();
            for (ImportedIngredient ingredient : recipe.ingredients()) {
                ReferenceIngredient mapped = state.ingredientMappings().get(ingredientKey(ingredient.name()));
                if (mapped == null) {
                    log.warn("No mapping for ingredient '{}' in '{}', skipped", ingredient.name(), recipe.title());
                    continue;
                }
                ingredients.add(mergeAmount(mapped, ingredient));
            }
            List<ReferenceTag> tags = new ArrayList<>();
            for (String tag : recipe.tags()) {
                ReferenceTag mapped = state.tagMappings().get(tagKey(tag));
                if (mapped == null) {
                    log.warn("No mapping for tag '{}' in '{}', skipped", tag, recipe.title());
                    continue;
                }
                tags.add(mapped);
            }
            validated.add(ValidatedRecipe.from(recipe, ingredients, tags));
        }
        return validated;
    }

    public ValidationProgress getProgress(BatchValidationState state) {
        long remainingIngredients = state.ingredientsToValidate().stream()
                .filter(pending -> !state.ingredientMappings().containsKey(ingredientKey(pending.ingredient().name())))
                .count();
        long remainingTags = state.tagsToValidate().stream()
                .filter(pending -> !state.tagMappings().containsKey(tagKey(pending.name())))
                .count();
        return new ValidationProgress(
                state.uniqueIngredients().size(),
                state.ingredientMappings().size(),
                state.uniqueTags().size(),
                state.tagMappings().size(),
                (int) remainingIngredients,
                (int) remainingTags);
    }

    static String ingredientKey(String name) {
        return NameNormalizer.normalizeKey(NameNormalizer.cleanName(name));
    }

    static String tagKey(String name) {
        return NameNormalizer.normalizeKey(name);
    }

    private static Map<String, ImportedIngredient> collectUniqueIngredients(List<ConvertedRecipe> recipes) {
        Map<String, ImportedIngredient> unique = new LinkedHashMap<>();
        for (ConvertedRecipe recipe : recipes) {
            for (ImportedIngredient ingredient : recipe.ingredients()) {
                String key = ingredientKey(ingredient.name());
                if (!key.isEmpty()) {
                    unique.putIfAbsent(key, ingredient);
                }
            }
        }
        return unique;
    }

    private static Map<String, String> collectUniqueTags(List<ConvertedRecipe> recipes) {
        Map<String, String> unique = new LinkedHashMap<>();
        for (ConvertedRecipe recipe : recipes) {
            for (String tag : recipe.tags()) {
                String key = tagKey(tag);
                if (!key.isEmpty()) {
                    unique.putIfAbsent(key, tag.trim());
                }
            }
        }
        return unique;
    }

    /**
     * Catalog identity, type and season; the recipe's quantity and unit when it has them.
     */
    private static ReferenceIngredient mergeAmount(ReferenceIngredient reference, ImportedIngredient imported) {
        String quantity = imported.quantity().isBlank() ? reference.quantity() : imported.quantity();
        String unit = imported.unit().isBlank() ? reference.unit() : imported.unit();
        return reference.withAmount(quantity, unit);
    }
}
