package dev.larder.discovery;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import dev.larder.fetch.CancellationSignal;
import dev.larder.provider.DiscoveredRecipeLink;
import dev.larder.provider.RecipeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scans a provider's listing pages for recipe links and reports progress as a stream of
 * {@link DiscoveryProgress} snapshots.
 *
 * <p>Flow of one run:
 * <ol>
 *   <li>resolve the provider base URL (eagerly, in {@link #discover})</li>
 *   <li>discover the listing pages and emit the initial snapshot</li>
 *   <li>scan one listing page per pulled snapshot until all are scanned, the recipe limit is
 *       reached or the signal is cancelled</li>
 *   <li>retry listing pages that came back empty before the last non-empty one</li>
 *   <li>emit the terminal snapshot and start image enrichment for links without a thumbnail</li>
 * </ol>
 */
@Service
public class DiscoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryEngine.class);

    private final DiscoveryProperties properties;
    private final ImageEnrichmentQueue imageQueue;

    public DiscoveryEngine(DiscoveryProperties properties, ImageEnrichmentQueue imageQueue) {
        this.properties = properties;
        this.imageQueue = imageQueue;
    }

    /**
     * Start a discovery run. Nothing is fetched until the first snapshot is pulled.
     *
     * @param provider site to scan
     * @param options  recipe limit, cancellation and image callback
     * @return the run, to be consumed as an iterator of snapshots
     * @throws dev.larder.provider.UnsupportedLocaleException if the provider has no edition for
     *                                                        the configured language
     */
    public DiscoveryRun discover(RecipeProvider provider, DiscoveryOptions options) {
        String baseUrl = provider.resolveBaseUrl();
        return new DiscoveryRun(provider, baseUrl, options);
    }

    /**
     * One discovery run. Not thread-safe: consume from a single thread.
     */
    public final class DiscoveryRun extends ProgressStream<DiscoveryProgress> {

        private final RecipeProvider provider;
        private final String baseUrl;
        private final DiscoveryOptions options;
        private final Integer maxRecipes;
        private final CancellationSignal signal;
        private final Map<String, DiscoveredRecipeLink> recipes = new LinkedHashMap<>();
        private final List<Integer> emptyPages = new ArrayList<>();
        private final Map<String, String> loadedImages = new ConcurrentHashMap<>();

        private List<String> categoryUrls = List.of();
        private int nextCategory;
        private int categoriesScanned;
        private int lastNonEmptyPage = -1;
        private boolean reachedMaxRecipes;
        private State state = State.NOT_STARTED;
        private CompletableFuture<Void> imageEnrichment = CompletableFuture.completedFuture(null);

        private DiscoveryRun(RecipeProvider provider, String baseUrl, DiscoveryOptions options) {
            this.provider = provider;
            this.baseUrl = baseUrl;
            this.options = options;
            this.maxRecipes = options.maxRecipes();
            this.signal = options.signal();
        }

        public String baseUrl() {
            return baseUrl;
        }

        /**
         * Background thumbnail lookup started with the terminal snapshot; already complete when
         * no image callback was given or nothing needed a thumbnail.
         */
        public CompletableFuture<Void> imageEnrichment() {
            return imageEnrichment;
        }

        /**
         * Links discovered so far, with the thumbnails found by image enrichment applied. Emitted
         * snapshots keep the links as they were.
         */
        public List<DiscoveredRecipeLink> recipesWithImages() {
            List<DiscoveredRecipeLink> links = new ArrayList<>(recipes.size());
            for (DiscoveredRecipeLink link : recipes.values()) {
                String imageUrl = loadedImages.get(link.url());
                links.add(imageUrl == null ? link : link.withImageUrl(imageUrl));
            }
            return links;
        }

        @Override
        protected DiscoveryProgress computeNext() {
            switch (state) {
                case NOT_STARTED:
                    if (signal.isCancelled()) {
                        log.info("Discovery for {} cancelled before start", provider.id());
                        state = State.FINISHED;
                        return snapshot(DiscoveryProgress.Phase.COMPLETE, true);
                    }
                    categoryUrls = List.copyOf(provider.discoverCategoryUrls(baseUrl, signal));
                    log.info("Starting discovery for {} at {}: {} listing pages",
                            provider.id(), baseUrl, categoryUrls.size());
                    state = State.SCANNING;
                    return snapshot(DiscoveryProgress.Phase.DISCOVERING, false);
                case SCANNING:
                    if (nextCategory < categoryUrls.size() && !signal.isCancelled() && !reachedMaxRecipes) {
                        scanCategory(nextCategory++);
                        return snapshot(DiscoveryProgress.Phase.DISCOVERING, false);
                    }
                    retryEmptyPages();
                    state = State.FINISHED;
                    return finish();
                default:
                    return null;
            }
        }

        private void scanCategory(int index) {
            String categoryUrl = categoryUrls.get(index);
            try {
                String html = provider.fetchPage(categoryUrl, signal);
                List<DiscoveredRecipeLink> links = provider.extractRecipeLinks(html, baseUrl);
                if (links.isEmpty()) {
                    log.debug("No recipe links on {}", categoryUrl);
                    emptyPages.add(index);
                } else {
                    lastNonEmptyPage = index;
                    addRecipes(links);
                }
            } catch (RuntimeException e) {
                if (signal.isCancelled()) {
                    log.debug("Listing page {} skipped after cancellation", categoryUrl);
                } else {
                    log.warn("Failed to scan listing page {}: {}", categoryUrl, e.getMessage());
                }
                emptyPages.add(index);
            }
            categoriesScanned++;
        }

        private void addRecipes(List<DiscoveredRecipeLink> links) {
            for (DiscoveredRecipeLink link : links) {
                if (reachedMaxRecipes) {
                    break;
                }
                if (recipes.putIfAbsent(link.url(), link) == null
                        && maxRecipes != null && recipes.size() >= maxRecipes) {
                    log.info("Max recipes reached for {}: {}", provider.id(), recipes.size());
                    reachedMaxRecipes = true;
                }
            }
        }

        /**
         * Listing pages that were empty although a later page had links were most likely
         * rate-limited. Retry them with a growing delay.
         */
        private void retryEmptyPages() {
            List<Integer> pending = new ArrayList<>();
            for (int index : emptyPages) {
                if (index < lastNonEmptyPage) {
                    pending.add(index);
                }
            }
            if (pending.isEmpty() || signal.isCancelled() || reachedMaxRecipes) {
                return;
            }

            log.info("Retrying {} possibly rate-limited listing pages for {}", pending.size(), provider.id());
            for (int attempt = 1; attempt <= properties.emptyPageRetries() && !pending.isEmpty(); attempt++) {
                if (!pause(properties.retryDelayMs() * attempt) || signal.isCancelled()) {
                    break;
                }
                List<Integer> stillEmpty = new ArrayList<>();
                for (int index : pending) {
                    if (signal.isCancelled() || reachedMaxRecipes) {
                        break;
                    }
                    if (!retryCategory(index)) {
                        stillEmpty.add(index);
                    }
                }
                log.info("Retry attempt {} for {}: {} recovered, {} still empty",
                        attempt, provider.id(), pending.size() - stillEmpty.size(), stillEmpty.size());
                pending = stillEmpty;
            }
            if (!pending.isEmpty()) {
                log.warn("{} listing pages still empty after retries for {}", pending.size(), provider.id());
            }
        }

        private boolean retryCategory(int index) {
            String categoryUrl = categoryUrls.get(index);
            try {
                List<DiscoveredRecipeLink> links =
                        provider.extractRecipeLinks(provider.fetchPage(categoryUrl, signal), baseUrl);
                if (links.isEmpty()) {
                    return false;
                }
                addRecipes(links);
                return true;
            } catch (RuntimeException e) {
                log.debug("Retry of {} failed: {}", categoryUrl, e.getMessage());
                return false;
            }
        }

        private DiscoveryProgress finish() {
            boolean cancelled = signal.isCancelled();
            log.info("Discovery for {} {}: {} recipes from {}/{} listing pages",
                    provider.id(), cancelled ? "cancelled" : "complete",
                    recipes.size(), categoriesScanned, categoryUrls.size());
            DiscoveryProgress terminal = snapshot(DiscoveryProgress.Phase.COMPLETE, cancelled);
            startImageEnrichment();
            return terminal;
        }

        private void startImageEnrichment() {
            if (options.onImageLoaded() == null || signal.isCancelled()) {
                return;
            }
            List<String> withoutImage = recipes.values().stream()
                    .filter(link -> !link.hasImage())
                    .map(DiscoveredRecipeLink::url)
                    .toList();
            imageEnrichment = imageQueue.enrich(provider, withoutImage, signal, (recipeUrl, imageUrl) -> {
                loadedImages.put(recipeUrl, imageUrl);
                options.onImageLoaded().accept(recipeUrl, imageUrl);
            });
        }

        private DiscoveryProgress snapshot(DiscoveryProgress.Phase phase, boolean cancelled) {
            boolean complete = phase == DiscoveryProgress.Phase.COMPLETE;
            return new DiscoveryProgress(
                    phase,
                    recipes.size(),
                    categoriesScanned,
                    categoryUrls.size(),
                    complete,
                    cancelled,
                    new ArrayList<>(recipes.values()));
        }

        private boolean pause(long millis) {
            if (millis <= 0) {
                return true;
            }
            try {
                Thread.sleep(millis);
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Retry pause interrupted for {}", provider.id());
                return false;
            }
        }
    }

    private enum State {
        NOT_STARTED,
        SCANNING,
        FINISHED
    }
}
