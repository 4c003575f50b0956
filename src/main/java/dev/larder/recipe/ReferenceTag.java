package dev.larder.recipe;

import org.jspecify.annotations.Nullable;

/**
 * Tag known to the reference catalog.
 *
 * @param id   catalog identifier, null for a tag not yet persisted
 * @param name display name
 */
public record ReferenceTag(@Nullable Long id, String name) {
}
