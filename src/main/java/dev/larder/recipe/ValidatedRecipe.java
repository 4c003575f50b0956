package dev.larder.recipe;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Recipe ready for persistence: every ingredient and tag refers to a catalog item.
 * Seasonality is left empty by the import.
 */
public record ValidatedRecipe(
        String title,
        String description,
        String imageUrl,
        int persons,
        int timeMinutes,
        List<ReferenceIngredient> ingredients,
        List<ReferenceTag> tags,
        @Nullable Nutrition nutrition,
        List<PreparationStep> preparation,
        List<String> season,
        String sourceUrl,
        String sourceProvider
) {

    public ValidatedRecipe {
        ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
        tags = tags == null ? List.of() : List.copyOf(tags);
        preparation = preparation == null ? List.of() : List.copyOf(preparation);
        season = season == null ? List.of() : List.copyOf(season);
    }

    /**
     * Build from a converted recipe with resolved ingredients and tags.
     */
    public static ValidatedRecipe from(ConvertedRecipe recipe, List<ReferenceIngredient> ingredients,
                                       List<ReferenceTag> tags) {
        return new ValidatedRecipe(
                recipe.title(),
                recipe.description(),
                recipe.imageUrl(),
                recipe.persons(),
                recipe.timeMinutes(),
                ingredients,
                tags,
                recipe.nutrition(),
                recipe.preparation(),
                List.of(),
                recipe.sourceUrl(),
                recipe.sourceProvider());
    }
}
