package dev.larder.discovery;

/**
 * Recipe page that could not be fetched or converted.
 *
 * @param url   page URL
 * @param title title shown during discovery
 * @param error failure message
 */
public record FailedRecipe(String url, String title, String error) {
}
