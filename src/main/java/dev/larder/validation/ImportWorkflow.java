package dev.larder.validation;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import dev.larder.catalog.CatalogException;
import dev.larder.catalog.RecipeCatalog;
import dev.larder.recipe.ConvertedRecipe;
import dev.larder.recipe.ReferenceIngredient;
import dev.larder.recipe.ReferenceTag;
import dev.larder.recipe.ValidatedRecipe;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one import batch from validation to storage.
 *
 * <p>Phases run {@code INITIALIZING -> TAGS -> INGREDIENTS -> IMPORTING -> COMPLETE | ERROR};
 * {@code TAGS} and {@code INGREDIENTS} are skipped when nothing needs a decision. Tags are always
 * validated before ingredients. An item left unresolved when its phase is finished is dropped
 * from the recipes.
 *
 * <p>All operations are synchronized; calling one outside its phase throws
 * {@link IllegalStateException}. Once a terminal phase is reached the recipes and the validation
 * state are released; only the final counts remain.
 */
public class ImportWorkflow {

    private static final Logger log = LoggerFactory.getLogger(ImportWorkflow.class);

    private final UUID id;
    private final int recipeCount;
    private final BatchValidator validator;
    private final RecipeCatalog catalog;
    private final Clock clock;
    private final Instant createdAt;

    private List<ConvertedRecipe> recipes;
    private ImportPhase phase = ImportPhase.INITIALIZING;
    private @Nullable BatchValidationState state;
    private @Nullable ValidationProgress finalProgress;
    private @Nullable Instant finishedAt;
    private int importedCount;
    private @Nullable String errorMessage;

    public ImportWorkflow(UUID id, List<ConvertedRecipe> recipes, BatchValidator validator,
                          RecipeCatalog catalog, Clock clock) {
        this.id = id;
        this.recipes = List.copyOf(recipes);
        this.recipeCount = this.recipes.size();
        this.validator = validator;
        this.catalog = catalog;
        this.clock = clock;
        this.createdAt = clock.instant();
    }

    public UUID id() {
        return id;
    }

    /**
     * Time the workflow reached {@link ImportPhase#COMPLETE} or {@link ImportPhase#ERROR}, null
     * while it is still running.
     */
    public synchronized @Nullable Instant finishedAt() {
        return finishedAt;
    }

    synchronized boolean holdsBatch() {
        return state != null || !recipes.isEmpty();
    }

    /**
     * Initialize the batch against the current catalog and move to the first phase needing
     * input. When everything matched exactly the recipes are imported right away.
     */
    public synchronized ImportSnapshot start() {
        requirePhase(ImportPhase.INITIALIZING);
        state = validator.initialize(recipes, catalog.allIngredients(), catalog.allTags());
        if (!state.tagsToValidate().isEmpty()) {
            phase = ImportPhase.TAGS;
        } else if (!state.ingredientsToValidate().isEmpty()) {
            phase = ImportPhase.INGREDIENTS;
        } else {
            runImport();
        }
        log.info("Import {} started with {} recipes, phase {}", id, recipeCount, phase);
        return snapshot();
    }

    /**
     * @param originalName tag name as imported
     * @param resolved     catalog tag, or a new tag without id
     * @throws IllegalArgumentException if the batch has no such tag
     */
    public synchronized ImportSnapshot resolveTag(String originalName, ReferenceTag resolved) {
        requirePhase(ImportPhase.TAGS);
        if (!state.uniqueTags().containsKey(BatchValidator.tagKey(originalName))) {
            throw new IllegalArgumentException("Tag '" + originalName + "' is not part of this import");
        }
        validator.addTagMapping(state, originalName, resolved);
        return snapshot();
    }

    public synchronized ImportSnapshot finishTags() {
        requirePhase(ImportPhase.TAGS);
        if (!state.ingredientsToValidate().isEmpty()) {
            phase = ImportPhase.INGREDIENTS;
        } else {
            runImport();
        }
        return snapshot();
    }

    /**
     * @param originalName ingredient name as imported
     * @param resolved     catalog ingredient, or a new ingredient without id
     * @throws IllegalArgumentException if the batch has no such ingredient
     */
    public synchronized ImportSnapshot resolveIngredient(String originalName, ReferenceIngredient resolved) {
        requirePhase(ImportPhase.INGREDIENTS);
        if (!state.uniqueIngredients().containsKey(BatchValidator.ingredientKey(originalName))) {
            throw new IllegalArgumentException("Ingredient '" + originalName + "' is not part of this import");
        }
        validator.addIngredientMapping(state, originalName, resolved);
        return snapshot();
    }

    public synchronized ImportSnapshot finishIngredients() {
        requirePhase(ImportPhase.INGREDIENTS);
        runImport();
        return snapshot();
    }

    public synchronized ImportSnapshot snapshot() {
        if (state == null) {
            return new ImportSnapshot(id, phase, recipeCount, finalProgress, List.of(), List.of(),
                    importedCount, errorMessage, createdAt);
        }
        BatchValidationState current = state;
        List<PendingTag> pendingTags = current.tagsToValidate().stream()
                .filter(tag -> !current.tagMappings().containsKey(BatchValidator.tagKey(tag.name())))
                .toList();
        List<PendingIngredient> pendingIngredients = current.ingredientsToValidate().stream()
                .filter(pending -> !current.ingredientMappings()
                        .containsKey(BatchValidator.ingredientKey(pending.ingredient().name())))
                .toList();
        return new ImportSnapshot(id, phase, recipeCount, validator.getProgress(current),
                pendingTags, pendingIngredients, importedCount, errorMessage, createdAt);
    }

    private void runImport() {
        phase = ImportPhase.IMPORTING;
        try {
            List<ValidatedRecipe> importable = validator.applyMappingsToRecipes(recipes, state).stream()
                    .filter(recipe -> !recipe.ingredients().isEmpty())
                    .toList();
            if (importable.isEmpty()) {
                throw new NoValidRecipesException(recipes.size());
            }
            if (importable.size() < recipes.size()) {
                log.warn("Import {}: {} recipes left without ingredients, not imported",
                        id, recipes.size() - importable.size());
            }
            importedCount = catalog.persist(importable);
            phase = ImportPhase.COMPLETE;
            log.info("Import {} complete: {} recipes stored", id, importedCount);
        } catch (NoValidRecipesException | CatalogException e) {
            errorMessage = e.getMessage();
            phase = ImportPhase.ERROR;
            log.error("Import {} failed: {}", id, e.getMessage());
        } catch (RuntimeException e) {
            errorMessage = "Import failed: " + e.getMessage();
            phase = ImportPhase.ERROR;
            log.error("Import {} failed", id, e);
        } finally {
            release();
        }
    }

    private void release() {
        finalProgress = validator.getProgress(state);
        finishedAt = clock.instant();
        state = null;
        recipes = List.of();
    }

    private void requirePhase(ImportPhase expected) {
        if (phase != expected) {
            throw new IllegalStateException("Import " + id + " is in phase " + phase + ", expected " + expected);
        }
    }
}
