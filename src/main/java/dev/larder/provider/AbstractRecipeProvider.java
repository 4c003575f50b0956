package dev.larder.provider;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import dev.larder.fetch.CancellationSignal;
import dev.larder.fetch.PageFetcher;
import dev.larder.recipe.ConvertedRecipe;
import dev.larder.schema.SchemaRecipeParser;
import dev.larder.schema.ScrapedRecipeConverter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared plumbing for providers whose recipe pages carry schema.org JSON-LD: page fetching,
 * conversion, image lookup and link extraction helpers.
 */
public abstract class AbstractRecipeProvider implements RecipeProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractRecipeProvider.class);

    protected final PageFetcher pageFetcher;
    protected final SchemaRecipeParser parser;
    protected final ScrapedRecipeConverter converter;

    protected AbstractRecipeProvider(PageFetcher pageFetcher, SchemaRecipeParser parser,
                                     ScrapedRecipeConverter converter) {
        this.pageFetcher = pageFetcher;
        this.parser = parser;
        this.converter = converter;
    }

    @Override
    public String fetchPage(String url, CancellationSignal signal) {
        return pageFetcher.fetch(url, signal);
    }

    @Override
    public ConvertedRecipe convertPage(String html, String pageUrl) {
        return converter.convert(parser.parse(html, pageUrl), pageUrl, id());
    }

    /**
     * JSON-LD recipe image, falling back to the Open Graph image of the page. Each candidate
     * must pass {@link #acceptImage} before it is used.
     */
    @Override
    public Optional<String> extractImageUrl(String html, String pageUrl) {
        return usableImage(parser.extractImage(html, pageUrl))
                .or(() -> usableImage(openGraphImage(html, pageUrl)));
    }

    private Optional<String> usableImage(Optional<String> candidate) {
        return candidate
                .map(ScrapedRecipeConverter::cleanImageUrl)
                .filter(url -> !url.isBlank())
                .filter(this::acceptImage);
    }

    /**
     * Hook for sites serving placeholder artwork; accepts everything by default.
     */
    protected boolean acceptImage(String imageUrl) {
        return true;
    }

    /**
     * Absolute http(s) links of every anchor in the page, in document order. Unparsable hrefs
     * are skipped.
     */
    protected static List<URI> absoluteLinks(String html, String baseUrl) {
        Document document = Jsoup.parse(html == null ? "" : html, baseUrl);
        List<URI> links = new ArrayList<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (href.isEmpty()) {
                continue;
            }
            try {
                URI uri = URI.create(href);
                String scheme = uri.getScheme();
                if (uri.getHost() != null && ("http".equals(scheme) || "https".equals(scheme))) {
                    links.add(uri);
                }
            } catch (IllegalArgumentException e) {
                log.debug("Skipping malformed link {}: {}", href, e.getMessage());
            }
        }
        return links;
    }

    /**
     * Readable title from a URL slug: {@code "poulet-roti"} becomes {@code "Poulet roti"}.
     */
    protected static String titleFromSlug(String slug) {
        String title = slug.replace('-', ' ');
        if (title.isEmpty()) {
            return title;
        }
        return title.substring(0, 1).toUpperCase(Locale.ROOT) + title.substring(1);
    }

    private static Optional<String> openGraphImage(String html, String pageUrl) {
        Document document = Jsoup.parse(html == null ? "" : html, pageUrl);
        Element meta = document.selectFirst("meta[property=og:image]");
        if (meta == null) {
            return Optional.empty();
        }
        String content = meta.absUrl("content");
        return content.isEmpty() ? Optional.empty() : Optional.of(content);
    }
}
