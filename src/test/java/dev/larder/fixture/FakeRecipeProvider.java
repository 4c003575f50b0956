package dev.larder.fixture;

import dev.larder.fetch.CancellationSignal;
import dev.larder.fetch.FetchFailureException;
import dev.larder.provider.DiscoveredRecipeLink;
import dev.larder.provider.RecipeProvider;
import dev.larder.recipe.ConvertedRecipe;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted {@link RecipeProvider} for engine tests. A listing page "fetch" returns the page URL
 * itself, and {@link #extractRecipeLinks} answers with the links scripted for that URL.
 *
 * <pre>{@code
 * FakeRecipeProvider provider = new FakeRecipeProvider()
 *     .listing("page-1", "r1", "r2")
 *     .listing("page-2", "r3");
 * }</pre>
 */
public final class FakeRecipeProvider implements RecipeProvider {

  public static final String BASE_URL = "https://fake.example";

  private final List<String> categories = new ArrayList<>();
  private final Map<String, Deque<List<String>>> listings = new HashMap<>();
  private final Set<String> failingUrls = new HashSet<>();
  private final Map<String, String> images = new ConcurrentHashMap<>();
  private final List<String> fetched = new CopyOnWriteArrayList<>();
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicInteger maxInFlight = new AtomicInteger();
  private long imageFetchMillis;
  private Runnable onFetch = () -> {};

  /** Listing page returning the given recipe slugs; successive calls for one page queue responses. */
  public FakeRecipeProvider listing(String page, String... slugs) {
    String url = url(page);
    if (!listings.containsKey(url)) {
      categories.add(url);
    }
    listings.computeIfAbsent(url, key -> new ArrayDeque<>()).add(List.of(slugs));
    return this;
  }

  public FakeRecipeProvider failing(String pageOrSlug) {
    failingUrls.add(url(pageOrSlug));
    return this;
  }

  public FakeRecipeProvider image(String slug, String imageUrl) {
    images.put(url(slug), imageUrl);
    return this;
  }

  public FakeRecipeProvider imageFetchMillis(long millis) {
    this.imageFetchMillis = millis;
    return this;
  }

  /** Hook run on every page fetch, e.g. to cancel a run midway. */
  public FakeRecipeProvider onFetch(Runnable onFetch) {
    this.onFetch = onFetch;
    return this;
  }

  public static String url(String slug) {
    return BASE_URL + "/" + slug;
  }

  public List<String> fetchedUrls() {
    return Collections.unmodifiableList(fetched);
  }

  public int maxConcurrentImageFetches() {
    return maxInFlight.get();
  }

  @Override
  public String id() {
    return "fake";
  }

  @Override
  public String displayName() {
    return "Fake";
  }

  @Override
  public String logoUrl() {
    return BASE_URL + "/logo.png";
  }

  @Override
  public Set<String> supportedLanguages() {
    return Set.of();
  }

  @Override
  public String resolveBaseUrl() {
    return BASE_URL;
  }

  @Override
  public List<String> discoverCategoryUrls(String baseUrl, CancellationSignal signal) {
    return List.copyOf(categories);
  }

  @Override
  public String fetchPage(String url, CancellationSignal signal) {
    if (signal.isCancelled()) {
      throw FetchFailureException.cancelled(url);
    }
    fetched.add(url);
    onFetch.run();
    if (failingUrls.contains(url)) {
      throw FetchFailureException.httpStatus(url, 500, "Internal Server Error");
    }
    return url;
  }

  @Override
  public List<DiscoveredRecipeLink> extractRecipeLinks(String html, String baseUrl) {
    Deque<List<String>> responses = listings.get(html);
    if (responses == null) {
      return List.of();
    }
    List<String> slugs = responses.size() > 1 ? responses.poll() : responses.peek();
    return slugs.stream().map(slug -> DiscoveredRecipeLink.of(url(slug), slug)).toList();
  }

  @Override
  public ConvertedRecipe convertPage(String html, String pageUrl) {
    String slug = pageUrl.substring(BASE_URL.length() + 1);
    return new ConvertedRecipeBuilder()
        .title(slug)
        .ingredients("Flour")
        .sourceUrl(pageUrl)
        .sourceProvider(id())
        .build();
  }

  @Override
  public Optional<String> extractImageUrl(String html, String pageUrl) {
    return Optional.ofNullable(images.get(pageUrl));
  }

  @Override
  public Optional<String> fetchImageUrl(String recipeUrl, CancellationSignal signal) {
    int current = inFlight.incrementAndGet();
    maxInFlight.accumulateAndGet(current, Math::max);
    try {
      if (imageFetchMillis > 0) {
        Thread.sleep(imageFetchMillis);
      }
      return RecipeProvider.super.fetchImageUrl(recipeUrl, signal);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while fetching " + recipeUrl, e);
    } finally {
      inFlight.decrementAndGet();
    }
  }
}
