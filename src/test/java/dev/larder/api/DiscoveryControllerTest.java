package dev.larder.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Set;

import dev.larder.catalog.ImportMemory;
import dev.larder.catalog.RecipeCatalog;
import dev.larder.config.GlobalExceptionHandler;
import dev.larder.discovery.DiscoveryEngine;
import dev.larder.discovery.DiscoveryProperties;
import dev.larder.discovery.ImageEnrichmentQueue;
import dev.larder.fixture.FakeRecipeProvider;
import dev.larder.provider.ProviderRegistry;
import dev.larder.provider.RecipeProvider;
import dev.larder.provider.UnsupportedLocaleException;
import dev.larder.schema.ScraperProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class DiscoveryControllerTest {

    @Mock
    private RecipeCatalog catalog;

    private FakeRecipeProvider provider;

    @BeforeEach
    void setUp() {
        provider = new FakeRecipeProvider()
                .listing("page-1", "a", "b")
                .image("a", "https://img.fake.example/a.jpg");
    }

    private MockMvc mockMvc(RecipeProvider... providers) {
        ProviderRegistry registry = new ProviderRegistry(List.of(providers),
                new ScraperProperties("fr", 4, List.of(), List.of()));
        DiscoveryEngine engine = new DiscoveryEngine(new DiscoveryProperties(0, 0),
                new ImageEnrichmentQueue(Runnable::run));
        DiscoveryController controller =
                new DiscoveryController(registry, engine, new ImportMemory(catalog), Runnable::run);
        return MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void discoveryStreamsProgressMemoryAndImages() throws Exception {
        when(catalog.importedSourceUrls("fake")).thenReturn(Set.of(FakeRecipeProvider.url("b")));

        MvcResult result = mockMvc(provider).perform(post("/api/providers/fake/discoveries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"hideImported\": true}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        String body = result.getResponse().getContentAsString();
        assertThat(body).contains("event:progress", "event:memory", "event:image");
        assertThat(body).contains("\"visible\":[\"https://fake.example/a\"]");
        assertThat(body).contains("\"https://fake.example/b\":\"IMPORTED\"");
        assertThat(body).contains("https://img.fake.example/a.jpg");
    }

    @Test
    void secondDiscoveryReportsLinksAsSeen() throws Exception {
        when(catalog.importedSourceUrls("fake")).thenReturn(Set.of());
        MockMvc mockMvc = mockMvc(provider);
        mockMvc.perform(post("/api/providers/fake/discoveries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"));

        MvcResult second = mockMvc.perform(post("/api/providers/fake/discoveries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andReturn();

        assertThat(second.getResponse().getContentAsString()).contains("\"https://fake.example/a\":\"SEEN\"");
    }

    @Test
    void unknownProviderIsBadRequest() throws Exception {
        mockMvc(provider).perform(post("/api/providers/nope/discoveries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void nonPositiveMaxRecipesIsBadRequest() throws Exception {
        mockMvc(provider).perform(post("/api/providers/fake/discoveries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"maxRecipes\": 0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unsupportedLanguageIsUnprocessable() throws Exception {
        RecipeProvider quitoque = mock(RecipeProvider.class);
        when(quitoque.id()).thenReturn("quitoque");
        when(quitoque.resolveBaseUrl())
                .thenThrow(new UnsupportedLocaleException("Quitoque", "quitoque", "en", List.of("fr")));

        mockMvc(quitoque).perform(post("/api/providers/quitoque/discoveries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.provider").value("quitoque"))
                .andExpect(jsonPath("$.language").value("en"));
    }
}
