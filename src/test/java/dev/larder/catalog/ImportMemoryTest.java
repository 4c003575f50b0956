package dev.larder.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ImportMemoryTest {

    private static final String IMPORTED = "https://www.quitoque.fr/recettes/imported";
    private static final String SEEN = "https://www.quitoque.fr/recettes/seen";
    private static final String FRESH = "https://www.quitoque.fr/recettes/fresh";

    @Mock
    private RecipeCatalog catalog;

    private ImportMemory memory;

    @BeforeEach
    void setUp() {
        memory = new ImportMemory(catalog);
    }

    @Test
    void statusesCombineSeenLinksWithImportHistory() {
        when(catalog.importedSourceUrls("quitoque")).thenReturn(Set.of(IMPORTED));
        memory.markSeen("quitoque", List.of(SEEN, IMPORTED));

        assertThat(memory.statuses("quitoque", List.of(FRESH, SEEN, IMPORTED)))
                .containsExactly(
                        Map.entry(FRESH, LinkStatus.FRESH),
                        Map.entry(SEEN, LinkStatus.SEEN),
                        Map.entry(IMPORTED, LinkStatus.IMPORTED));
    }

    @Test
    void seenLinksArePerProvider() {
        when(catalog.importedSourceUrls("hellofresh")).thenReturn(Set.of());
        memory.markSeen("quitoque", List.of(SEEN));

        assertThat(memory.statuses("hellofresh", List.of(SEEN))).containsEntry(SEEN, LinkStatus.FRESH);
    }

    @Test
    void visibleDropsImportedLinksOnlyWhenAsked() {
        when(catalog.importedSourceUrls("quitoque")).thenReturn(Set.of(IMPORTED));

        assertThat(memory.visible("quitoque", List.of(FRESH, IMPORTED), true)).containsExactly(FRESH);
        assertThat(memory.visible("quitoque", List.of(FRESH, IMPORTED), false)).containsExactly(FRESH, IMPORTED);
    }
}
