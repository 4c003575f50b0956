package dev.larder.validation;

import java.util.List;

import dev.larder.recipe.ReferenceTag;

/**
 * Imported tag without an exact catalog match.
 *
 * @param name        first-seen spelling of the tag in the batch
 * @param suggestions similar catalog tags, best first; may be empty
 */
public record PendingTag(String name, List<ReferenceTag> suggestions) {

    public PendingTag {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public boolean hasSuggestions() {
        return !suggestions.isEmpty();
    }
}
