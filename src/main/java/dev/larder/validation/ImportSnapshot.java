package dev.larder.validation;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.jspecify.annotations.Nullable;

/**
 * Point-in-time view of an import session.
 *
 * @param id                 session id
 * @param phase              current phase
 * @param recipeCount        recipes in the batch
 * @param progress           validation counts, null before initialization
 * @param pendingTags        tags still waiting for a decision
 * @param pendingIngredients ingredients still waiting for a decision
 * @param importedCount      recipes stored, 0 until {@link ImportPhase#COMPLETE}
 * @param errorMessage       reason of the failure in {@link ImportPhase#ERROR}
 * @param createdAt          session creation time
 */
public record ImportSnapshot(
        UUID id,
        ImportPhase phase,
        int recipeCount,
        @Nullable ValidationProgress progress,
        List<PendingTag> pendingTags,
        List<PendingIngredient> pendingIngredients,
        int importedCount,
        @Nullable String errorMessage,
        Instant createdAt
) {

    public ImportSnapshot {
        pendingTags = pendingTags == null ? List.of() : List.copyOf(pendingTags);
        pendingIngredients = pendingIngredients == null ? List.of() : List.copyOf(pendingIngredients);
    }
}
