package dev.larder.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.larder.fetch.CancellationSignal;
import dev.larder.fetch.PageFetcher;
import dev.larder.fixture.HtmlFixtures;
import dev.larder.schema.SchemaRecipeParser;
import dev.larder.schema.ScrapedRecipeConverter;
import dev.larder.schema.ScraperProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QuitoqueProviderTest {

    @Mock
    private PageFetcher pageFetcher;

    private QuitoqueProvider provider;

    @BeforeEach
    void setUp() {
        provider = provider("fr");
    }

    private QuitoqueProvider provider(String language) {
        ScraperProperties properties = new ScraperProperties(language, 4, List.of("sel"), List.of("eau"));
        return new QuitoqueProvider(pageFetcher, new SchemaRecipeParser(new ObjectMapper()),
                new ScrapedRecipeConverter(properties), properties);
    }

    @Test
    void resolveBaseUrlOnlyForFrench() {
        assertThat(provider.resolveBaseUrl()).isEqualTo(QuitoqueProvider.BASE_URL);
        assertThatThrownBy(() -> provider("en").resolveBaseUrl())
                .isInstanceOf(UnsupportedLocaleException.class)
                .hasMessageContaining("Quitoque");
    }

    @Test
    void extractMaxPageFindsHighestPageNumber() {
        assertThat(QuitoqueProvider.extractMaxPage(HtmlFixtures.load("quitoque-listing.html"))).isEqualTo(12);
        assertThat(QuitoqueProvider.extractMaxPage("<html></html>")).isZero();
        assertThat(QuitoqueProvider.extractMaxPage(null)).isZero();
    }

    @Test
    void discoverCategoryUrlsListsEveryPage() {
        when(pageFetcher.fetch(eq("https://www.quitoque.fr/recettes?page=1"), any(CancellationSignal.class)))
                .thenReturn(HtmlFixtures.load("quitoque-listing.html"));

        List<String> pages = provider.discoverCategoryUrls(QuitoqueProvider.BASE_URL, CancellationSignal.none());

        assertThat(pages).hasSize(12)
                .startsWith("https://www.quitoque.fr/recettes?page=1")
                .endsWith("https://www.quitoque.fr/recettes?page=12");
    }

    @Test
    void discoverCategoryUrlsWithoutPaginationIsEmpty() {
        when(pageFetcher.fetch(any(), any(CancellationSignal.class))).thenReturn("<html><body></body></html>");

        assertThat(provider.discoverCategoryUrls(QuitoqueProvider.BASE_URL, CancellationSignal.none())).isEmpty();
    }

    @Test
    void extractRecipeLinksKeepsRecipePagesOfTheSite() {
        List<DiscoveredRecipeLink> links =
                provider.extractRecipeLinks(HtmlFixtures.load("quitoque-listing.html"), QuitoqueProvider.BASE_URL);

        assertThat(links).extracting(DiscoveredRecipeLink::url).containsExactly(
                "https://www.quitoque.fr/recettes/gnocchis-sauce-tomate",
                "https://www.quitoque.fr/recettes/curry-de-lentilles-corail");
        assertThat(links).extracting(DiscoveredRecipeLink::title)
                .containsExactly("Gnocchis sauce tomate", "Curry de lentilles corail");
    }

    @Test
    void extractImageUrlFallsBackToOpenGraphImage() {
        String pageUrl = "https://www.quitoque.fr/recettes/a-propos";

        assertThat(provider.extractImageUrl(HtmlFixtures.load("no-recipe.html"), pageUrl))
                .contains("https://www.quitoque.fr/images/about.png");
    }

    @Test
    void extractImageUrlRejectsPlaceholderArtwork() {
        String html = "<html><head><meta property=\"og:image\" "
                + "content=\"https://www.quitoque.fr/build/placeholder-recipe.jpg\"></head></html>";

        assertThat(provider.extractImageUrl(html, "https://www.quitoque.fr/recettes/x")).isEmpty();
    }

    @Test
    void placeholderRecipeImageFallsBackToOpenGraphImage() {
        String html = "<html><head>"
                + "<meta property=\"og:image\" content=\"https://www.quitoque.fr/media/curry.jpg\">"
                + "<script type=\"application/ld+json\">"
                + "{\"@type\":\"Recipe\",\"name\":\"Curry\",\"image\":\"https://www.quitoque.fr/build/Placeholder.png\"}"
                + "</script></head></html>";

        assertThat(provider.extractImageUrl(html, "https://www.quitoque.fr/recettes/curry"))
                .contains("https://www.quitoque.fr/media/curry.jpg");
    }
}
