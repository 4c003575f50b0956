package dev.larder.api;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import dev.larder.config.GlobalExceptionHandler;
import dev.larder.recipe.IngredientType;
import dev.larder.validation.ImportPhase;
import dev.larder.validation.ImportSessionNotFoundException;
import dev.larder.validation.ImportSessionService;
import dev.larder.validation.ImportSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ImportControllerTest {

    private static final UUID ID = UUID.fromString("6f1c2a57-0c1e-4d7e-9b0a-3f2d5e8a9c10");

    @Mock
    private ImportSessionService sessions;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ImportController(sessions))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static ImportSnapshot snapshot(ImportPhase phase) {
        return new ImportSnapshot(ID, phase, 1, null, List.of(), List.of(), 0, null,
                Instant.parse("2026-03-01T10:00:00Z"));
    }

    @Test
    void createStartsSession() throws Exception {
        when(sessions.create(anyList())).thenReturn(snapshot(ImportPhase.TAGS));

        mockMvc.perform(post("/api/imports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"recipes": [{
                                  "title": "Pizza",
                                  "persons": 2,
                                  "ingredients": [{"name": "Flour", "quantity": "200", "unit": "g"}],
                                  "tags": ["Italien"],
                                  "sourceUrl": "https://www.hellofresh.fr/recipes/pizza-0123456789abcdef01234567",
                                  "sourceProvider": "hellofresh"
                                }]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(ID.toString()))
                .andExpect(jsonPath("$.phase").value("TAGS"));
    }

    @Test
    void createWithoutRecipesIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/imports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipes\": []}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        when(sessions.get(ID)).thenThrow(new ImportSessionNotFoundException(ID));

        mockMvc.perform(get("/api/imports/{id}", ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Import session not found: " + ID));
    }

    @Test
    void stepOutOfPhaseIsConflict() throws Exception {
        when(sessions.finishTags(ID)).thenThrow(new IllegalStateException("Import is in phase INGREDIENTS"));

        mockMvc.perform(post("/api/imports/{id}/tags/complete", ID))
                .andExpect(status().isConflict());
    }

    @Test
    void resolveTagPassesDecision() throws Exception {
        when(sessions.resolveTag(ID, "Quik", 2L, null)).thenReturn(snapshot(ImportPhase.TAGS));

        mockMvc.perform(post("/api/imports/{id}/tags", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"originalName\": \"Quik\", \"tagId\": 2}"))
                .andExpect(status().isOk());

        verify(sessions).resolveTag(ID, "Quik", 2L, null);
    }

    @Test
    void resolveTagWithoutNameIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/imports/{id}/tags", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"originalName\": \"\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void resolveIngredientCreatesTypedIngredient() throws Exception {
        when(sessions.resolveIngredient(ID, "Zzyzx", null, "Zzyzx berry", IngredientType.FRUIT))
                .thenReturn(snapshot(ImportPhase.INGREDIENTS));

        mockMvc.perform(post("/api/imports/{id}/ingredients", ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"originalName\": \"Zzyzx\", \"newName\": \"Zzyzx berry\", \"type\": \"FRUIT\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("INGREDIENTS"));
    }

    @Test
    void finishIngredientsReturnsFinalSnapshot() throws Exception {
        when(sessions.finishIngredients(ID)).thenReturn(snapshot(ImportPhase.COMPLETE));

        mockMvc.perform(post("/api/imports/{id}/ingredients/complete", ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("COMPLETE"));
    }

    @Test
    void discardRemovesSession() throws Exception {
        mockMvc.perform(delete("/api/imports/{id}", ID))
                .andExpect(status().isNoContent());

        verify(sessions).discard(ID);
    }
}
