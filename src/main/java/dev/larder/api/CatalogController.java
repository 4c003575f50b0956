package dev.larder.api;

import dev.larder.catalog.RecipeCatalog;
import dev.larder.matching.FuzzySearchResult;
import dev.larder.recipe.ReferenceIngredient;
import dev.larder.recipe.ReferenceTag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Single-item lookups used when a recipe is edited by hand, outside a batch import.
 */
@RestController
@RequestMapping("/api/catalog")
public class CatalogController {

    private final RecipeCatalog catalog;

    public CatalogController(RecipeCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping("/ingredients/similar")
    public FuzzySearchResult<ReferenceIngredient> similarIngredients(@RequestParam String name) {
        return catalog.findSimilarIngredients(name);
    }

    @GetMapping("/tags/similar")
    public FuzzySearchResult<ReferenceTag> similarTags(@RequestParam String name) {
        return catalog.findSimilarTags(name);
    }
}
