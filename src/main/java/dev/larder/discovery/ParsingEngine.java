package dev.larder.discovery;

import java.util.ArrayList;
import java.util.List;

import dev.larder.fetch.CancellationSignal;
import dev.larder.fetch.FetchFailureException;
import dev.larder.provider.DiscoveredRecipeLink;
import dev.larder.provider.RecipeProvider;
import dev.larder.recipe.ConvertedRecipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fetches and converts a user-selected set of recipe links, one per pulled
 * {@link ParseProgress} snapshot. A failing link is recorded and the run moves on.
 */
@Service
public class ParsingEngine {

    private static final Logger log = LoggerFactory.getLogger(ParsingEngine.class);

    /**
     * Start a parsing run. Nothing is fetched until snapshots are pulled.
     *
     * @param provider provider owning the links
     * @param links    selected links, processed in order
     * @param options  cancellation
     * @return the run, to be consumed as an iterator of snapshots
     */
    public ParsingRun parseSelected(RecipeProvider provider, List<DiscoveredRecipeLink> links,
                                    ParseOptions options) {
        return new ParsingRun(provider, List.copyOf(links), options.signal());
    }

    /**
     * One parsing run. Not thread-safe: consume from a single thread.
     */
    public static final class ParsingRun extends ProgressStream<ParseProgress> {

        private final RecipeProvider provider;
        private final List<DiscoveredRecipeLink> links;
        private final CancellationSignal signal;
        private final List<ConvertedRecipe> parsed = new ArrayList<>();
        private final List<FailedRecipe> failed = new ArrayList<>();

        private boolean started;
        private boolean finished;
        private int current;

        private ParsingRun(RecipeProvider provider, List<DiscoveredRecipeLink> links, CancellationSignal signal) {
            this.provider = provider;
            this.links = links;
            this.signal = signal;
        }

        @Override
        protected ParseProgress computeNext() {
            if (!started) {
                started = true;
                log.info("Parsing {} selected recipes from {}", links.size(), provider.id());
                return snapshot(ParseProgress.Phase.PARSING, null, false);
            }
            if (finished) {
                return null;
            }
            if (current == links.size()) {
                finished = true;
                return snapshot(ParseProgress.Phase.COMPLETE, null, false);
            }
            if (signal.isCancelled()) {
                return cancelled();
            }

            DiscoveredRecipeLink link = links.get(current);
            if (!parse(link)) {
                return cancelled();
            }
            current++;
            if (current == links.size()) {
                finished = true;
                log.info("Parsing from {} complete: {} parsed, {} failed",
                        provider.id(), parsed.size(), failed.size());
                return snapshot(ParseProgress.Phase.COMPLETE, link.title(), false);
            }
            return snapshot(ParseProgress.Phase.PARSING, link.title(), false);
        }

        /**
         * @return false when the fetch was refused because the run was cancelled meanwhile
         */
        private boolean parse(DiscoveredRecipeLink link) {
            try {
                String html = provider.fetchPage(link.url(), signal);
                parsed.add(provider.convertPage(html, link.url()));
            } catch (FetchFailureException e) {
                if (e.isCancelled()) {
                    return false;
                }
                recordFailure(link, e);
            } catch (RuntimeException e) {
                recordFailure(link, e);
            }
            return true;
        }

        private void recordFailure(DiscoveredRecipeLink link, RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Failed to parse {}: {}", link.url(), message);
            failed.add(new FailedRecipe(link.url(), link.title(), message));
        }

        private ParseProgress cancelled() {
            finished = true;
            log.info("Parsing from {} cancelled after {}/{} recipes", provider.id(), current, links.size());
            return snapshot(ParseProgress.Phase.COMPLETE, null, true);
        }

        private ParseProgress snapshot(ParseProgress.Phase phase, String currentTitle, boolean cancelled) {
            return new ParseProgress(phase, current, links.size(), currentTitle, parsed, failed, cancelled);
        }
    }
}
