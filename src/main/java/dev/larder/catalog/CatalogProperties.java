package dev.larder.catalog;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param ingredientsResource Spring resource location of the reference ingredient list (JSON)
 * @param tagsResource        Spring resource location of the reference tag list (JSON)
 */
@ConfigurationProperties(prefix = "larder.catalog")
public record CatalogProperties(String ingredientsResource, String tagsResource) {

    public CatalogProperties {
        ingredientsResource = ingredientsResource == null
                ? "classpath:reference/ingredients.json" : ingredientsResource;
        tagsResource = tagsResource == null ? "classpath:reference/tags.json" : tagsResource;
    }
}
