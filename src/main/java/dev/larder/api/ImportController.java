package dev.larder.api;

import java.util.UUID;

import dev.larder.validation.ImportSessionService;
import dev.larder.validation.ImportSnapshot;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Import sessions: validate the tags, then the ingredients, of a batch of parsed recipes and
 * store them. Every call returns the session snapshot.
 */
@RestController
@RequestMapping("/api/imports")
public class ImportController {

    private final ImportSessionService sessions;

    public ImportController(ImportSessionService sessions) {
        this.sessions = sessions;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ImportSnapshot create(@Valid @RequestBody ImportRequest request) {
        return sessions.create(request.recipes());
    }

    @GetMapping("/{id}")
    public ImportSnapshot get(@PathVariable UUID id) {
        return sessions.get(id);
    }

    @PostMapping("/{id}/tags")
    public ImportSnapshot resolveTag(@PathVariable UUID id, @Valid @RequestBody TagResolutionRequest request) {
        return sessions.resolveTag(id, request.originalName(), request.tagId(), request.newName());
    }

    @PostMapping("/{id}/tags/complete")
    public ImportSnapshot finishTags(@PathVariable UUID id) {
        return sessions.finishTags(id);
    }

    @PostMapping("/{id}/ingredients")
    public ImportSnapshot resolveIngredient(@PathVariable UUID id,
                                           @Valid @RequestBody IngredientResolutionRequest request) {
        return sessions.resolveIngredient(id, request.originalName(), request.ingredientId(),
                request.newName(), request.type());
    }

    @PostMapping("/{id}/ingredients/complete")
    public ImportSnapshot finishIngredients(@PathVariable UUID id) {
        return sessions.finishIngredients(id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void discard(@PathVariable UUID id) {
        sessions.discard(id);
    }
}
