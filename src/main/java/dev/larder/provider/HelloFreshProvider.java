package dev.larder.provider;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import dev.larder.fetch.CancellationSignal;
import dev.larder.fetch.PageFetcher;
import dev.larder.schema.SchemaRecipeParser;
import dev.larder.schema.ScrapedRecipeConverter;
import dev.larder.schema.ScraperProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HelloFresh meal-kit recipes, one regional site per language.
 *
 * <p>Categories are the {@code /recipes/<slug>} pages linked from {@code /recipes}; recipe pages
 * are recognized by the 24-character hexadecimal id ending their slug.
 */
@Component
public class HelloFreshProvider extends AbstractRecipeProvider {

    private static final Logger log = LoggerFactory.getLogger(HelloFreshProvider.class);

    static final String ID = "hellofresh";

    private static final String LOGO_URL =
            "https://media.hellofresh.com/w_256,q_100,f_auto,c_limit,fl_lossy/hellofresh_website/logo/Hello_Fresh_Lockup.png";

    private static final String BASE = "https://www.hellofresh";

    private static final Map<String, String> TLD_BY_LANGUAGE = tldByLanguage();

    private static final Pattern HOST = Pattern.compile("www\\.hellofresh\\.[a-z]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern CATEGORY_PATH = Pattern.compile("^/recipes/[a-z0-9-]+$", Pattern.CASE_INSENSITIVE);
    private static final Pattern RECIPE_PATH =
            Pattern.compile("^/recipes/[a-z0-9-]+-[a-f0-9]{24}$", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEX_ID_SUFFIX = Pattern.compile("-?[a-f0-9]{24}$", Pattern.CASE_INSENSITIVE);

    private final ScraperProperties properties;

    public HelloFreshProvider(PageFetcher pageFetcher, SchemaRecipeParser parser,
                              ScrapedRecipeConverter converter, ScraperProperties properties) {
        super(pageFetcher, parser, converter);
        this.properties = properties;
    }

    private static Map<String, String> tldByLanguage() {
        Map<String, String> tlds = new LinkedHashMap<>();
        tlds.put("en", ".com");
        tlds.put("fr", ".fr");
        tlds.put("de", ".de");
        tlds.put("nl", ".nl");
        tlds.put("it", ".it");
        tlds.put("es", ".es");
        tlds.put("da", ".dk");
        tlds.put("sv", ".se");
        tlds.put("nb", ".no");
        return Collections.unmodifiableMap(tlds);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String displayName() {
        return "HelloFresh";
    }

    @Override
    public String logoUrl() {
        return LOGO_URL;
    }

    @Override
    public Set<String> supportedLanguages() {
        return TLD_BY_LANGUAGE.keySet();
    }

    /**
     * Regional site for the configured language, e.g. {@code https://www.hellofresh.fr}.
     */
    @Override
    public String resolveBaseUrl() {
        String language = properties.language();
        String tld = TLD_BY_LANGUAGE.get(language);
        if (tld == null) {
            throw new UnsupportedLocaleException(displayName(), ID, language, TLD_BY_LANGUAGE.keySet());
        }
        String baseUrl = BASE + tld;
        log.debug("HelloFresh region selected for language {}: {}", language, baseUrl);
        return baseUrl;
    }

    @Override
    public List<String> discoverCategoryUrls(String baseUrl, CancellationSignal signal) {
        String recipesPageUrl = baseUrl + "/recipes";
        try {
            String html = fetchPage(recipesPageUrl, signal);
            List<String> categories = extractCategoryUrls(html, baseUrl);
            log.info("Discovered {} HelloFresh categories from {}", categories.size(), recipesPageUrl);
            return categories;
        } catch (RuntimeException e) {
            log.error("Failed to discover HelloFresh categories from {}: {}", recipesPageUrl, e.getMessage());
            return List.of();
        }
    }

    /**
     * Category pages linked from the recipes landing page: {@code /recipes/<slug>} without a
     * recipe id and other than {@code /recipes} itself.
     */
    List<String> extractCategoryUrls(String html, String baseUrl) {
        Set<String> categories = new LinkedHashSet<>();
        for (URI link : absoluteLinks(html, baseUrl)) {
            if (!isSiteLink(link)) {
                continue;
            }
            String path = link.getRawPath();
            if (CATEGORY_PATH.matcher(path).matches() && !HEX_ID_SUFFIX.matcher(path).find()) {
                categories.add(link.toString());
            }
        }
        return new ArrayList<>(categories);
    }

    @Override
    public List<DiscoveredRecipeLink> extractRecipeLinks(String html, String baseUrl) {
        Set<String> seen = new LinkedHashSet<>();
        List<DiscoveredRecipeLink> links = new ArrayList<>();
        for (URI link : absoluteLinks(html, baseUrl)) {
            if (!isSiteLink(link) || !RECIPE_PATH.matcher(link.getRawPath()).matches()) {
                continue;
            }
            String url = link.toString();
            if (seen.add(url)) {
                links.add(DiscoveredRecipeLink.of(url, titleFromPath(link.getRawPath())));
            }
        }
        return links;
    }

    private static boolean isSiteLink(URI link) {
        return link.getRawPath() != null
                && link.getRawQuery() == null
                && link.getRawFragment() == null
                && HOST.matcher(link.getHost()).matches();
    }

    private static String titleFromPath(String path) {
        String slug = path.substring("/recipes/".length());
        return titleFromSlug(HEX_ID_SUFFIX.matcher(slug).replaceFirst(""));
    }
}
