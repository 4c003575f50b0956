package dev.larder.discovery;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;

import dev.larder.fetch.CancellationSignal;
import dev.larder.provider.RecipeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Background thumbnail lookup for discovered links that have no image yet.
 *
 * <p>A fixed number of workers, never more than {@link #MAX_CONCURRENT_IMAGE_FETCHES}, pull URLs
 * from one shared queue, so at most that many recipe pages are being fetched at any moment.
 * Workers check the cancellation signal before taking the next URL; a fetch already in flight
 * runs to completion. Failures are logged and otherwise ignored.
 */
@Component
public class ImageEnrichmentQueue {

    private static final Logger log = LoggerFactory.getLogger(ImageEnrichmentQueue.class);

    public static final int MAX_CONCURRENT_IMAGE_FETCHES = 5;

    private final Executor executor;

    public ImageEnrichmentQueue(@Qualifier("imageFetchExecutor") Executor executor) {
        this.executor = executor;
    }

    /**
     * Look up the image of every given recipe page.
     *
     * @param provider      provider owning the pages
     * @param recipeUrls    pages to inspect
     * @param signal        stops workers between fetches
     * @param onImageLoaded called with {@code (recipeUrl, imageUrl)} for each image found, from a
     *                      worker thread
     * @return completes once every worker has stopped
     */
    public CompletableFuture<Void> enrich(RecipeProvider provider, List<String> recipeUrls,
                                          CancellationSignal signal,
                                          BiConsumer<String, String> onImageLoaded) {
        if (recipeUrls.isEmpty() || signal.isCancelled()) {
            return CompletableFuture.completedFuture(null);
        }

        Queue<String> pending = new ConcurrentLinkedQueue<>(recipeUrls);
        int workers = Math.min(MAX_CONCURRENT_IMAGE_FETCHES, recipeUrls.size());
        log.debug("Enriching {} recipe images with {} workers", recipeUrls.size(), workers);

        CompletableFuture<?>[] running = new CompletableFuture<?>[workers];
        for (int i = 0; i < workers; i++) {
            running[i] = CompletableFuture.runAsync(
                    () -> work(provider, pending, signal, onImageLoaded), executor);
        }
        return CompletableFuture.allOf(running);
    }

    private void work(RecipeProvider provider, Queue<String> pending, CancellationSignal signal,
                      BiConsumer<String, String> onImageLoaded) {
        while (!signal.isCancelled()) {
            String recipeUrl = pending.poll();
            if (recipeUrl == null) {
                return;
            }
            try {
                provider.fetchImageUrl(recipeUrl, signal)
                        .ifPresent(imageUrl -> onImageLoaded.accept(recipeUrl, imageUrl));
            } catch (RuntimeException e) {
                log.debug("Image lookup failed for {}: {}", recipeUrl, e.getMessage());
            }
        }
    }
}
