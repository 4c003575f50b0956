package dev.larder.schema;

import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * Raw recipe fields read from a page's structured data, before any conversion.
 * Absent values are null (scalars) or empty (collections).
 *
 * @param title               schema.org {@code name}
 * @param description         schema.org {@code description}
 * @param ingredients         raw ingredient lines ({@code recipeIngredient})
 * @param instructions        instructions as one newline-separated text
 * @param instructionsList    instructions split into steps
 * @param totalTime           total time in minutes
 * @param prepTime            preparation time in minutes
 * @param yields              servings text, e.g. "4 servings"
 * @param image               main image URL
 * @param keywords            keywords, or user-facing page-state tags as a fallback
 * @param dietaryRestrictions {@code suitableForDiet} values without the schema.org prefix
 * @param nutrients           nutrition facts by schema.org property name, as text
 */
public record ScrapedRecipe(
        @Nullable String title,
        @Nullable String description,
        List<String> ingredients,
        @Nullable String instructions,
        List<String> instructionsList,
        @Nullable Integer totalTime,
        @Nullable Integer prepTime,
        @Nullable String yields,
        @Nullable String image,
        List<String> keywords,
        List<String> dietaryRestrictions,
        Map<String, String> nutrients
) {

    public ScrapedRecipe {
        ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
        instructionsList = instructionsList == null ? List.of() : List.copyOf(instructionsList);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        dietaryRestrictions = dietaryRestrictions == null ? List.of() : List.copyOf(dietaryRestrictions);
        nutrients = nutrients == null ? Map.of() : Map.copyOf(nutrients);
    }
}
