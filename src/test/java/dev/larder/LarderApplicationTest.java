package dev.larder;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import dev.larder.catalog.RecipeCatalog;
import dev.larder.fixture.ConvertedRecipeBuilder;
import dev.larder.provider.ProviderRegistry;
import dev.larder.provider.RecipeProvider;
import dev.larder.validation.ImportPhase;
import dev.larder.validation.ImportSessionService;
import dev.larder.validation.ImportSnapshot;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class LarderApplicationTest {

    @Autowired
    private ProviderRegistry registry;

    @Autowired
    private RecipeCatalog catalog;

    @Autowired
    private ImportSessionService sessions;

    @Test
    void contextWiresProvidersAndReferenceCatalog() {
        assertThat(registry.availableProviders()).extracting(RecipeProvider::id)
                .containsExactly("hellofresh", "quitoque");
        assertThat(catalog.allIngredients()).hasSizeGreaterThan(40);
        assertThat(catalog.allTags()).isNotEmpty();
    }

    @Test
    void batchMatchingReferenceDataImportsWithoutQuestions() {
        ImportSnapshot snapshot = sessions.create(List.of(new ConvertedRecipeBuilder()
                .title("Crêpes")
                .ingredient("Farine", "250", "g")
                .ingredient("lait", "50", "cl")
                .tags("rapide")
                .sourceUrl("https://www.quitoque.fr/recettes/crepes")
                .sourceProvider("quitoque")
                .build()));

        assertThat(snapshot.phase()).isEqualTo(ImportPhase.COMPLETE);
        assertThat(snapshot.importedCount()).isEqualTo(1);
        assertThat(catalog.importedSourceUrls("quitoque")).contains("https://www.quitoque.fr/recettes/crepes");
    }
}
