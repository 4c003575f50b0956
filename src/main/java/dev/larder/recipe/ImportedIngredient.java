package dev.larder.recipe;

/**
 * Ingredient line as extracted from a recipe page, before reconciliation with the catalog.
 *
 * @param name     ingredient name, parenthetical annotations already removed
 * @param quantity textual quantity ("2", "1.5"), empty when unknown
 * @param unit     unit of measurement, empty when unknown
 */
public record ImportedIngredient(String name, String quantity, String unit) {

    public ImportedIngredient {
        name = name == null ? "" : name;
        quantity = quantity == null ? "" : quantity;
        unit = unit == null ? "" : unit;
    }

    public static ImportedIngredient named(String name) {
        return new ImportedIngredient(name, "", "");
    }
}
