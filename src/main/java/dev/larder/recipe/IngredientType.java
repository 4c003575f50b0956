package dev.larder.recipe;

/**
 * Ingredient categories used by the reference catalog for grouping and shopping lists.
 */
public enum IngredientType {
    CEREAL,
    LEGUMES,
    VEGETABLE,
    PLANT_PROTEIN,
    CONDIMENT,
    SAUCE,
    MEAT,
    POULTRY,
    FISH,
    SEAFOOD,
    DAIRY,
    CHEESE,
    SUGAR,
    SPICE,
    FRUIT,
    OIL_AND_FAT,
    NUTS_AND_SEEDS,
    SWEETENER,
    /** Not yet categorized, e.g. an ingredient created during import. */
    UNDEFINED
}
