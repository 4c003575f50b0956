package dev.larder.schema;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for turning scraped pages into recipes.
 *
 * @param language                      ISO 639-1 code of the user's language, selects regional sites
 * @param defaultPersons                servings assumed when a page states none
 * @param ignoredIngredientPrefixes     ingredient lines starting with one of these are skipped
 * @param ignoredIngredientExactMatches ingredient lines equal to one of these are skipped
 */
@ConfigurationProperties(prefix = "larder.scraper")
public record ScraperProperties(
        String language,
        int defaultPersons,
        List<String> ignoredIngredientPrefixes,
        List<String> ignoredIngredientExactMatches
) {

    public ScraperProperties {
        language = language == null || language.isBlank() ? "en" : language;
        defaultPersons = defaultPersons > 0 ? defaultPersons : 4;
        ignoredIngredientPrefixes = ignoredIngredientPrefixes == null
                ? List.of() : List.copyOf(ignoredIngredientPrefixes);
        ignoredIngredientExactMatches = ignoredIngredientExactMatches == null
                ? List.of() : List.copyOf(ignoredIngredientExactMatches);
    }
}
