package dev.larder.provider;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

import dev.larder.fetch.CancellationSignal;
import dev.larder.fetch.PageFetcher;
import dev.larder.schema.SchemaRecipeParser;
import dev.larder.schema.ScrapedRecipeConverter;
import dev.larder.schema.ScraperProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Quitoque, a French meal-kit service. The catalog is paginated rather than categorized, so
 * each listing page plays the role of a category.
 */
@Component
public class QuitoqueProvider extends AbstractRecipeProvider {

    private static final Logger log = LoggerFactory.getLogger(QuitoqueProvider.class);

    static final String ID = "quitoque";

    static final String BASE_URL = "https://www.quitoque.fr";

    private static final String LOGO_URL =
            "https://www.quitoque.fr/media/cache/logo_10_years/build/quitoque/theme/images/logo-10-years.47dd494d.png";

    private static final Set<String> LANGUAGES = Set.of("fr");

    private static final String HOST = "www.quitoque.fr";
    private static final Pattern PAGINATION = Pattern.compile("\\?page=(\\d{1,5})");
    private static final Pattern RECIPE_PATH = Pattern.compile("^/recettes/[a-z0-9][a-z0-9-]*[a-z0-9]$");

    private final ScraperProperties properties;

    public QuitoqueProvider(PageFetcher pageFetcher, SchemaRecipeParser parser,
                            ScrapedRecipeConverter converter, ScraperProperties properties) {
        super(pageFetcher, parser, converter);
        this.properties = properties;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String displayName() {
        return "Quitoque";
    }

    @Override
    public String logoUrl() {
        return LOGO_URL;
    }

    @Override
    public Set<String> supportedLanguages() {
        return LANGUAGES;
    }

    @Override
    public String resolveBaseUrl() {
        if (!supportsLanguage(properties.language())) {
            throw new UnsupportedLocaleException(displayName(), ID, properties.language(), LANGUAGES);
        }
        return BASE_URL;
    }

    /**
     * Listing pages 1..N, N being the highest page number linked from the first page.
     */
    @Override
    public List<String> discoverCategoryUrls(String baseUrl, CancellationSignal signal) {
        String firstPageUrl = baseUrl + "/recettes?page=1";
        try {
            String html = fetchPage(firstPageUrl, signal);
            int maxPage = extractMaxPage(html);
            if (maxPage == 0) {
                log.warn("No pagination found on {}", firstPageUrl);
                return List.of();
            }
            log.info("Discovered {} Quitoque listing pages", maxPage);
            return IntStream.rangeClosed(1, maxPage)
                    .mapToObj(page -> baseUrl + "/recettes?page=" + page)
                    .toList();
        } catch (RuntimeException e) {
            log.error("Failed to discover Quitoque pages from {}: {}", firstPageUrl, e.getMessage());
            return List.of();
        }
    }

    /**
     * Highest {@code ?page=N} value in the page, 0 when there is none.
     */
    static int extractMaxPage(String html) {
        int maxPage = 0;
        Matcher matcher = PAGINATION.matcher(html == null ? "" : html);
        while (matcher.find()) {
            maxPage = Math.max(maxPage, Integer.parseInt(matcher.group(1)));
        }
        return maxPage;
    }

    @Override
    public List<DiscoveredRecipeLink> extractRecipeLinks(String html, String baseUrl) {
        Set<String> seen = new LinkedHashSet<>();
        List<DiscoveredRecipeLink> links = new ArrayList<>();
        for (URI link : absoluteLinks(html, baseUrl)) {
            String path = link.getRawPath();
            if (!HOST.equalsIgnoreCase(link.getHost()) || path == null || link.getRawQuery() != null
                    || !RECIPE_PATH.matcher(path).matches()) {
                continue;
            }
            String url = BASE_URL + path;
            if (seen.add(url)) {
                links.add(DiscoveredRecipeLink.of(url, titleFromSlug(path.substring("/recettes/".length()))));
            }
        }
        return links;
    }

    /**
     * The site serves placeholder artwork for some recipes; those are treated as no image.
     */
    @Override
    protected boolean acceptImage(String imageUrl) {
        return !imageUrl.toLowerCase(Locale.ROOT).contains("placeholder");
    }
}
