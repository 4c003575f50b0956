package dev.larder.validation;

/**
 * Counts for one batch validation.
 *
 * @param totalIngredients     distinct ingredients in the batch
 * @param validatedIngredients ingredients with a mapping (exact or user-resolved)
 * @param totalTags            distinct tags in the batch
 * @param validatedTags        tags with a mapping
 * @param remainingIngredients pending ingredients not resolved yet
 * @param remainingTags        pending tags not resolved yet
 */
public record ValidationProgress(
        int totalIngredients,
        int validatedIngredients,
        int totalTags,
        int validatedTags,
        int remainingIngredients,
        int remainingTags
) {
}
