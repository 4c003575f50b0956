package dev.larder.recipe;

/**
 * Nutrition facts per 100 g. Energy is given in both kcal and kJ, masses in grams.
 *
 * @param portionWeight weight of one serving in grams, as stated by the source
 */
public record Nutrition(
        double energyKcal,
        double energyKj,
        double fat,
        double saturatedFat,
        double carbohydrates,
        double sugars,
        double fiber,
        double protein,
        double salt,
        double portionWeight
) {
}
