package dev.larder.recipe;

/**
 * One step of a recipe's method.
 *
 * @param title       optional section title, empty when the source has none
 * @param description step text, plain (no markup)
 */
public record PreparationStep(String title, String description) {

    public PreparationStep {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
    }
}
