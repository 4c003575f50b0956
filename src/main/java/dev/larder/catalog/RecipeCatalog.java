package dev.larder.catalog;

import java.util.List;
import java.util.Set;

import dev.larder.matching.FuzzySearchResult;
import dev.larder.recipe.ReferenceIngredient;
import dev.larder.recipe.ReferenceTag;
import dev.larder.recipe.ValidatedRecipe;

/**
 * Reference data and recipe storage consumed by the import pipeline.
 */
public interface RecipeCatalog {

    List<ReferenceIngredient> allIngredients();

    List<ReferenceTag> allTags();

    /**
     * Exact or similar catalog ingredients for a name, compared without parenthetical
     * annotations at {@link dev.larder.matching.MatchLevel#PERMISSIVE}.
     */
    FuzzySearchResult<ReferenceIngredient> findSimilarIngredients(String name);

    /**
     * Exact or similar catalog tags at {@link dev.larder.matching.MatchLevel#MODERATE}.
     */
    FuzzySearchResult<ReferenceTag> findSimilarTags(String name);

    /**
     * Store validated recipes. Ingredients and tags without an id are added to the catalog.
     *
     * @param recipes recipes to store
     * @return number of recipes stored
     * @throws CatalogException if storage fails; nothing is stored in that case
     */
    int persist(List<ValidatedRecipe> recipes);

    /**
     * Source URLs of recipes already imported from a provider.
     */
    Set<String> importedSourceUrls(String providerId);
}
