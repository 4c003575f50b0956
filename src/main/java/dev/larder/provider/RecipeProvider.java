package dev.larder.provider;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import dev.larder.fetch.CancellationSignal;
import dev.larder.fetch.FetchFailureException;
import dev.larder.recipe.ConvertedRecipe;
import dev.larder.schema.ParseFailureException;

/**
 * Site-specific knowledge needed to discover and import recipes from one recipe website.
 *
 * <p>Implementations are stateless: the base URL resolved for a run is passed back explicitly
 * to the operations that need it.
 */
public interface RecipeProvider {

    /** Stable identifier used in URLs and import history, e.g. {@code hellofresh}. */
    String id();

    String displayName();

    String logoUrl();

    /**
     * Languages with a site edition; an empty set means every language.
     */
    Set<String> supportedLanguages();

    default boolean supportsLanguage(String language) {
        return supportedLanguages().isEmpty() || supportedLanguages().contains(language);
    }

    /**
     * Root URL of the site edition matching the configured language.
     *
     * @throws UnsupportedLocaleException if the provider has no edition for that language
     */
    String resolveBaseUrl();

    /**
     * Listing pages to scan for recipe links. Failures are logged and yield an empty list.
     *
     * @param baseUrl value returned by {@link #resolveBaseUrl()}
     * @param signal  cancellation for the discovery run
     * @return category or pagination URLs, in scan order
     */
    List<String> discoverCategoryUrls(String baseUrl, CancellationSignal signal);

    /**
     * Download a page of this site.
     *
     * @throws FetchFailureException on network failure, error status, or cancellation
     */
    String fetchPage(String url, CancellationSignal signal);

    /**
     * Recipe links found in a listing page, de-duplicated by URL, category links excluded.
     *
     * @param html    listing page HTML
     * @param baseUrl base for resolving relative links
     * @return links in page order
     */
    List<DiscoveredRecipeLink> extractRecipeLinks(String html, String baseUrl);

    /**
     * Convert a recipe page into canonical form.
     *
     * @throws ParseFailureException if the page carries no structured recipe
     */
    ConvertedRecipe convertPage(String html, String pageUrl);

    /**
     * Main image of a recipe page, if it can be determined.
     */
    Optional<String> extractImageUrl(String html, String pageUrl);

    /**
     * Fetch a recipe page and read its main image.
     *
     * @throws FetchFailureException if the page cannot be fetched
     */
    default Optional<String> fetchImageUrl(String recipeUrl, CancellationSignal signal) {
        return extractImageUrl(fetchPage(recipeUrl, signal), recipeUrl);
    }
}
