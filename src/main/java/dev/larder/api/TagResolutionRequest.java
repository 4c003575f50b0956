package dev.larder.api;

import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * @param originalName tag as imported
 * @param tagId        existing catalog tag, or null to create one
 * @param newName      name of the tag to create, defaults to the imported name
 */
public record TagResolutionRequest(@NotBlank String originalName, @Nullable Long tagId, @Nullable String newName) {
}
