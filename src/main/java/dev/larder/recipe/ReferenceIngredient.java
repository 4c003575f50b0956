package dev.larder.recipe;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Ingredient known to the reference catalog. Also the resolved form of an imported ingredient,
 * in which case {@code quantity} and {@code unit} come from the recipe.
 *
 * @param id       catalog identifier, null for an ingredient not yet persisted
 * @param name     canonical name
 * @param unit     unit of measurement
 * @param quantity textual quantity, empty for catalog entries
 * @param type     ingredient category
 * @param season   months (as strings "1".."12") when in season
 */
public record ReferenceIngredient(
        @Nullable Long id,
        String name,
        String unit,
        String quantity,
        IngredientType type,
        List<String> season
) {

    public ReferenceIngredient {
        unit = unit == null ? "" : unit;
        quantity = quantity == null ? "" : quantity;
        type = type == null ? IngredientType.UNDEFINED : type;
        season = season == null ? List.of() : List.copyOf(season);
    }

    /**
     * Copy carrying the recipe-specific amount, keeping catalog identity, type and season.
     */
    public ReferenceIngredient withAmount(String quantity, String unit) {
        return new ReferenceIngredient(id, name, unit, quantity, type, season);
    }
}
