package dev.larder.validation;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import dev.larder.catalog.RecipeCatalog;
import dev.larder.recipe.ConvertedRecipe;
import dev.larder.recipe.IngredientType;
import dev.larder.recipe.ReferenceIngredient;
import dev.larder.recipe.ReferenceTag;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Holds the active {@link ImportWorkflow} instances, keyed by session id.
 *
 * <p>Sessions live in memory and are lost on restart. A session is removed when discarded, or
 * once it has been finished for longer than the configured retention; expired sessions are
 * evicted whenever a new one is created.
 */
@Service
public class ImportSessionService {

    private static final Logger log = LoggerFactory.getLogger(ImportSessionService.class);

    private final ConcurrentHashMap<UUID, ImportWorkflow> sessions = new ConcurrentHashMap<>();
    private final BatchValidator validator;
    private final RecipeCatalog catalog;
    private final Clock clock;
    private final ImportProperties properties;

    public ImportSessionService(BatchValidator validator, RecipeCatalog catalog, Clock clock,
                                ImportProperties properties) {
        this.validator = validator;
        this.catalog = catalog;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Create a session for a batch and start it.
     *
     * @param recipes parsed recipes selected for import
     * @return the session after initialization
     * @throws IllegalArgumentException if the batch is empty
     */
    public ImportSnapshot create(List<ConvertedRecipe> recipes) {
        if (recipes.isEmpty()) {
            throw new IllegalArgumentException("An import needs at least one recipe");
        }
        evictFinished();
        ImportWorkflow workflow = new ImportWorkflow(UUID.randomUUID(), recipes, validator, catalog, clock);
        sessions.put(workflow.id(), workflow);
        return workflow.start();
    }

    public ImportSnapshot get(UUID id) {
        return workflow(id).snapshot();
    }

    /**
     * Map an imported tag to an existing catalog tag, or to a new one when {@code tagId} is null.
     */
    public ImportSnapshot resolveTag(UUID id, String originalName, @Nullable Long tagId, @Nullable String newName) {
        ImportWorkflow workflow = workflow(id);
        ReferenceTag resolved = tagId != null
                ? catalogTag(tagId)
                : new ReferenceTag(null, nameOrOriginal(newName, originalName));
        return workflow.resolveTag(originalName, resolved);
    }

    public ImportSnapshot finishTags(UUID id) {
        return workflow(id).finishTags();
    }

    /**
     * Map an imported ingredient to an existing catalog ingredient, or to a new one when
     * {@code ingredientId} is null.
     */
    public ImportSnapshot resolveIngredient(UUID id, String originalName, @Nullable Long ingredientId,
                                            @Nullable String newName, @Nullable IngredientType type) {
        ImportWorkflow workflow = workflow(id);
        ReferenceIngredient resolved = ingredientId != null
                ? catalogIngredient(ingredientId)
                : new ReferenceIngredient(null, nameOrOriginal(newName, originalName), "", "", type, List.of());
        return workflow.resolveIngredient(originalName, resolved);
    }

    public ImportSnapshot finishIngredients(UUID id) {
        return workflow(id).finishIngredients();
    }

    public void discard(UUID id) {
        if (sessions.remove(id) == null) {
            throw new ImportSessionNotFoundException(id);
        }
        log.info("Import session {} discarded", id);
    }

    private void evictFinished() {
        Instant cutoff = clock.instant().minus(properties.finishedSessionRetention());
        sessions.values().removeIf(workflow -> {
            Instant finishedAt = workflow.finishedAt();
            if (finishedAt == null || !finishedAt.isBefore(cutoff)) {
                return false;
            }
            log.debug("Import session {} evicted, finished at {}", workflow.id(), finishedAt);
            return true;
        });
    }

    private ImportWorkflow workflow(UUID id) {
        return Optional.ofNullable(sessions.get(id))
                .orElseThrow(() -> new ImportSessionNotFoundException(id));
    }

    private ReferenceTag catalogTag(long tagId) {
        return catalog.allTags().stream()
                .filter(tag -> tag.id() != null && tag.id() == tagId)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown tag id: " + tagId));
    }

    private ReferenceIngredient catalogIngredient(long ingredientId) {
        return catalog.allIngredients().stream()
                .filter(ingredient -> ingredient.id() != null && ingredient.id() == ingredientId)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown ingredient id: " + ingredientId));
    }

    private static String nameOrOriginal(@Nullable String newName, String originalName) {
        return newName == null || newName.isBlank() ? originalName.trim() : newName.trim();
    }
}
