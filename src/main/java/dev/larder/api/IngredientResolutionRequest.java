package dev.larder.api;

import dev.larder.recipe.IngredientType;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * @param originalName ingredient as imported
 * @param ingredientId existing catalog ingredient, or null to create one
 * @param newName      name of the ingredient to create, defaults to the imported name
 * @param type         type of the ingredient to create
 */
public record IngredientResolutionRequest(
        @NotBlank String originalName,
        @Nullable Long ingredientId,
        @Nullable String newName,
        @Nullable IngredientType type
) {
}
