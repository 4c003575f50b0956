package dev.larder.api;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

import dev.larder.catalog.ImportMemory;
import dev.larder.catalog.LinkStatus;
import dev.larder.discovery.DiscoveryEngine;
import dev.larder.discovery.DiscoveryOptions;
import dev.larder.discovery.DiscoveryProgress;
import dev.larder.fetch.CancellationSignal;
import dev.larder.provider.DiscoveredRecipeLink;
import dev.larder.provider.ProviderRegistry;
import dev.larder.provider.RecipeProvider;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Streams a discovery run as server-sent events.
 *
 * <p>Events: {@code progress} for every {@link DiscoveryProgress} snapshot, {@code memory} once
 * the run is complete (status of each link against the import history) and {@code image} for
 * each thumbnail found after completion. The stream closes when image enrichment is done.
 * Closing it from the client cancels the run.
 */
@RestController
@RequestMapping("/api/providers/{providerId}/discoveries")
public class DiscoveryController {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryController.class);
    private static final long STREAM_TIMEOUT_MS = 30 * 60 * 1000L;

    private final ProviderRegistry registry;
    private final DiscoveryEngine discoveryEngine;
    private final ImportMemory importMemory;
    private final Executor streamExecutor;

    public DiscoveryController(ProviderRegistry registry, DiscoveryEngine discoveryEngine, ImportMemory importMemory,
                               @Qualifier("streamExecutor") Executor streamExecutor) {
        this.registry = registry;
        this.discoveryEngine = discoveryEngine;
        this.importMemory = importMemory;
        this.streamExecutor = streamExecutor;
    }

    @PostMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter discover(@PathVariable String providerId, @Valid @RequestBody DiscoveryRequest request) {
        RecipeProvider provider = registry.get(providerId);
        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);
        CancellationSignal signal = new CancellationSignal();
        emitter.onCompletion(signal::cancel);
        emitter.onTimeout(signal::cancel);
        emitter.onError(error -> {
            log.debug("Discovery stream for {} closed: {}", providerId, error.getMessage());
            signal.cancel();
        });

        // resolves the base URL here so an unsupported language fails the request itself
        DiscoveryEngine.DiscoveryRun run = discoveryEngine.discover(provider,
                new DiscoveryOptions(request.maxRecipes(), signal,
                        (recipeUrl, imageUrl) -> sendImage(emitter, signal, recipeUrl, imageUrl)));

        streamExecutor.execute(() -> stream(provider, run, request.hideImported(), emitter, signal));
        return emitter;
    }

    private void stream(RecipeProvider provider, DiscoveryEngine.DiscoveryRun run, boolean hideImported,
                        SseEmitter emitter, CancellationSignal signal) {
        try {
            DiscoveryProgress last = null;
            while (run.hasNext()) {
                last = run.next();
                SseEvents.send(emitter, "progress", last);
            }
            if (last != null && !last.cancelled()) {
                List<String> urls = last.recipes().stream().map(DiscoveredRecipeLink::url).toList();
                Map<String, LinkStatus> statuses = importMemory.statuses(provider.id(), urls);
                importMemory.markSeen(provider.id(), urls);
                SseEvents.send(emitter, "memory",
                        new LinkMemoryEvent(statuses, importMemory.visible(provider.id(), urls, hideImported)));
            }
            run.imageEnrichment().whenComplete((ignored, error) -> SseEvents.complete(emitter));
        } catch (IllegalStateException e) {
            log.info("Discovery stream for {} stopped: {}", provider.id(), e.getMessage());
            signal.cancel();
            SseEvents.complete(emitter);
        } catch (RuntimeException e) {
            log.error("Discovery for {} failed", provider.id(), e);
            signal.cancel();
            SseEvents.sendErrorAndComplete(emitter, "Discovery failed: " + e.getMessage());
        }
    }

    private void sendImage(SseEmitter emitter, CancellationSignal signal, String recipeUrl, String imageUrl) {
        try {
            SseEvents.send(emitter, "image", new ImageLoadedEvent(recipeUrl, imageUrl));
        } catch (IllegalStateException e) {
            log.debug("Image event for {} not delivered, cancelling: {}", recipeUrl, e.getMessage());
            signal.cancel();
        }
    }

    public record ImageLoadedEvent(String recipeUrl, String imageUrl) {
    }

    /**
     * @param statuses status of every discovered link
     * @param visible  links to show, imported ones removed when requested
     */
    public record LinkMemoryEvent(Map<String, LinkStatus> statuses, List<String> visible) {
    }
}
