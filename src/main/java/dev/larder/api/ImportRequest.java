package dev.larder.api;

import java.util.List;

import dev.larder.recipe.ConvertedRecipe;
import jakarta.validation.constraints.NotEmpty;

public record ImportRequest(@NotEmpty List<ConvertedRecipe> recipes) {
}
