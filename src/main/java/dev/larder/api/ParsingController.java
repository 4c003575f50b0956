package dev.larder.api;

import java.util.List;
import java.util.concurrent.Executor;

import dev.larder.discovery.ParseOptions;
import dev.larder.discovery.ParseProgress;
import dev.larder.discovery.ParsingEngine;
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
 * Streams the parsing of selected links as {@code progress} events, one {@link ParseProgress}
 * per processed link. Closing the stream cancels the remaining links.
 */
@RestController
@RequestMapping("/api/providers/{providerId}/parses")
public class ParsingController {

    private static final Logger log = LoggerFactory.getLogger(ParsingController.class);
    private static final long STREAM_TIMEOUT_MS = 30 * 60 * 1000L;

    private final ProviderRegistry registry;
    private final ParsingEngine parsingEngine;
    private final Executor streamExecutor;

    public ParsingController(ProviderRegistry registry, ParsingEngine parsingEngine,
                             @Qualifier("streamExecutor") Executor streamExecutor) {
        this.registry = registry;
        this.parsingEngine = parsingEngine;
        this.streamExecutor = streamExecutor;
    }

    @PostMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter parse(@PathVariable String providerId, @Valid @RequestBody ParseRequest request) {
        RecipeProvider provider = registry.get(providerId);
        List<DiscoveredRecipeLink> links = request.links().stream()
                .map(link -> DiscoveredRecipeLink.of(link.url(), link.title()))
                .toList();

        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);
        CancellationSignal signal = new CancellationSignal();
        emitter.onCompletion(signal::cancel);
        emitter.onTimeout(signal::cancel);
        emitter.onError(error -> signal.cancel());

        ParsingEngine.ParsingRun run = parsingEngine.parseSelected(provider, links, new ParseOptions(signal));
        streamExecutor.execute(() -> stream(provider, run, emitter, signal));
        return emitter;
    }

    private void stream(RecipeProvider provider, ParsingEngine.ParsingRun run, SseEmitter emitter,
                        CancellationSignal signal) {
        try {
            while (run.hasNext()) {
                SseEvents.send(emitter, "progress", run.next());
            }
            SseEvents.complete(emitter);
        } catch (IllegalStateException e) {
            log.info("Parsing stream for {} stopped: {}", provider.id(), e.getMessage());
            signal.cancel();
            SseEvents.complete(emitter);
        } catch (RuntimeException e) {
            log.error("Parsing for {} failed", provider.id(), e);
            signal.cancel();
            SseEvents.sendErrorAndComplete(emitter, "Parsing failed: " + e.getMessage());
        }
    }
}
