package dev.larder.recipe;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Recipe in canonical form, produced by a provider from a fetched page.
 *
 * @param title              recipe title
 * @param description        short description, empty when absent
 * @param imageUrl           main image URL, empty when absent
 * @param persons            number of servings
 * @param timeMinutes        total (or preparation) time in minutes, 0 when unknown
 * @param ingredients        parsed ingredient lines
 * @param tags               tag names, de-duplicated case-insensitively
 * @param nutrition          per-100 g nutrition facts, null when the source gives no serving size
 * @param preparation        ordered method steps
 * @param skippedIngredients raw ingredient lines deliberately not imported (salt, water...)
 * @param sourceUrl          page the recipe was extracted from
 * @param sourceProvider     id of the provider that produced it
 */
public record ConvertedRecipe(
        String title,
        String description,
        String imageUrl,
        int persons,
        int timeMinutes,
        List<ImportedIngredient> ingredients,
        List<String> tags,
        @Nullable Nutrition nutrition,
        List<PreparationStep> preparation,
        List<String> skippedIngredients,
        String sourceUrl,
        String sourceProvider
) {

    public ConvertedRecipe {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        imageUrl = imageUrl == null ? "" : imageUrl;
        ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
        tags = tags == null ? List.of() : List.copyOf(tags);
        preparation = preparation == null ? List.of() : List.copyOf(preparation);
        skippedIngredients = skippedIngredients == null ? List.of() : List.copyOf(skippedIngredients);
        sourceUrl = sourceUrl == null ? "" : sourceUrl;
        sourceProvider = sourceProvider == null ? "" : sourceProvider;
    }
}
