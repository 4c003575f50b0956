package dev.larder.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.larder.matching.FuzzyMatcher;
import dev.larder.matching.FuzzySearchResult;
import dev.larder.matching.MatchLevel;
import dev.larder.matching.NameNormalizer;
import dev.larder.recipe.ReferenceIngredient;
import dev.larder.recipe.ReferenceTag;
import dev.larder.recipe.ValidatedRecipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Catalog kept in memory, seeded from the bundled reference dataset. Stored recipes are lost on
 * restart.
 */
@Component
public class InMemoryRecipeCatalog implements RecipeCatalog {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRecipeCatalog.class);

    private final List<ReferenceIngredient> ingredients = new ArrayList<>();
    private final List<ReferenceTag> tags = new ArrayList<>();
    private final List<ValidatedRecipe> recipes = new ArrayList<>();
    private final AtomicLong ingredientIds = new AtomicLong();
    private final AtomicLong tagIds = new AtomicLong();

    @Autowired
    public InMemoryRecipeCatalog(CatalogProperties properties, ResourceLoader resourceLoader,
                                 ObjectMapper objectMapper) {
        this(load(resourceLoader.getResource(properties.ingredientsResource()), objectMapper,
                        new TypeReference<List<ReferenceIngredient>>() {}),
                load(resourceLoader.getResource(properties.tagsResource()), objectMapper,
                        new TypeReference<List<ReferenceTag>>() {}));
    }

    InMemoryRecipeCatalog(List<ReferenceIngredient> ingredients, List<ReferenceTag> tags) {
        for (ReferenceIngredient ingredient : ingredients) {
            this.ingredients.add(withIngredientId(ingredient));
        }
        for (ReferenceTag tag : tags) {
            this.tags.add(withTagId(tag));
        }
        log.info("Reference catalog loaded: {} ingredients, {} tags", this.ingredients.size(), this.tags.size());
    }

    private static <T> List<T> load(Resource resource, ObjectMapper objectMapper, TypeReference<List<T>> type) {
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new CatalogException("Failed to load reference data from " + resource.getDescription(), e);
        }
    }

    @Override
    public synchronized List<ReferenceIngredient> allIngredients() {
        return List.copyOf(ingredients);
    }

    @Override
    public synchronized List<ReferenceTag> allTags() {
        return List.copyOf(tags);
    }

    @Override
    public FuzzySearchResult<ReferenceIngredient> findSimilarIngredients(String name) {
        return FuzzyMatcher.search(allIngredients(), NameNormalizer.cleanName(name),
                ingredient -> NameNormalizer.cleanName(ingredient.name()), MatchLevel.PERMISSIVE);
    }

    @Override
    public FuzzySearchResult<ReferenceTag> findSimilarTags(String name) {
        return FuzzyMatcher.search(allTags(), name, ReferenceTag::name, MatchLevel.MODERATE);
    }

    /**
     * Stores the recipes; ingredients and tags without an id are added to the reference lists
     * first (reusing an entry added earlier in the same call when the name matches).
     */
    @Override
    public synchronized int persist(List<ValidatedRecipe> toStore) {
        Map<String, ReferenceIngredient> newIngredients = new LinkedHashMap<>();
        Map<String, ReferenceTag> newTags = new LinkedHashMap<>();
        List<ValidatedRecipe> stored = new ArrayList<>();

        for (ValidatedRecipe recipe : toStore) {
            if (recipe.title().isBlank()) {
                throw new CatalogException("Recipe from " + recipe.sourceUrl() + " has no title");
            }
            List<ReferenceIngredient> resolvedIngredients = new ArrayList<>();
            for (ReferenceIngredient ingredient : recipe.ingredients()) {
                if (ingredient.id() != null) {
                    resolvedIngredients.add(ingredient);
                    continue;
                }
                ReferenceIngredient created = newIngredients.computeIfAbsent(
                        NameNormalizer.normalizeKey(ingredient.name()),
                        key -> withIngredientId(ingredient.withAmount("", ingredient.unit())));
                resolvedIngredients.add(created.withAmount(ingredient.quantity(), ingredient.unit()));
            }
            List<ReferenceTag> resolvedTags = new ArrayList<>();
            for (ReferenceTag tag : recipe.tags()) {
                resolvedTags.add(tag.id() != null ? tag
                        : newTags.computeIfAbsent(NameNormalizer.normalizeKey(tag.name()), key -> withTagId(tag)));
            }
            stored.add(new ValidatedRecipe(recipe.title(), recipe.description(), recipe.imageUrl(),
                    recipe.persons(), recipe.timeMinutes(), resolvedIngredients, resolvedTags,
                    recipe.nutrition(), recipe.preparation(), recipe.season(), recipe.sourceUrl(),
                    recipe.sourceProvider()));
        }

        ingredients.addAll(newIngredients.values());
        tags.addAll(newTags.values());
        recipes.addAll(stored);
        log.info("Stored {} recipes ({} new ingredients, {} new tags)",
                stored.size(), newIngredients.size(), newTags.size());
        return stored.size();
    }

    @Override
    public synchronized Set<String> importedSourceUrls(String providerId) {
        Set<String> urls = new LinkedHashSet<>();
        for (ValidatedRecipe recipe : recipes) {
            if (recipe.sourceProvider().equals(providerId)) {
                urls.add(recipe.sourceUrl());
            }
        }
        return urls;
    }

    synchronized List<ValidatedRecipe> storedRecipes() {
        return List.copyOf(recipes);
    }

    private ReferenceIngredient withIngredientId(ReferenceIngredient ingredient) {
        if (ingredient.id() != null) {
            ingredientIds.accumulateAndGet(ingredient.id(), Math::max);
            return ingredient;
        }
        return new ReferenceIngredient(ingredientIds.incrementAndGet(), ingredient.name(), ingredient.unit(),
                ingredient.quantity(), ingredient.type(), ingredient.season());
    }

    private ReferenceTag withTagId(ReferenceTag tag) {
        if (tag.id() != null) {
            tagIds.accumulateAndGet(tag.id(), Math::max);
            return tag;
        }
        return new ReferenceTag(tagIds.incrementAndGet(), tag.name());
    }
}
