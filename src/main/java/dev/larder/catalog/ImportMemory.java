package dev.larder.catalog;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

/**
 * Remembers which recipe links were already shown to the user, per provider, and combines that
 * with the catalog's import history to classify newly discovered links.
 *
 * <p>Seen links are kept in memory only.
 */
@Component
public class ImportMemory {

    private final ConcurrentHashMap<String, Set<String>> seenByProvider = new ConcurrentHashMap<>();
    private final RecipeCatalog catalog;

    public ImportMemory(RecipeCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Record links as seen once a discovery run has shown them.
     *
     * @param providerId provider the links belong to
     * @param urls       recipe URLs
     */
    public void markSeen(String providerId, Collection<String> urls) {
        seenByProvider.computeIfAbsent(providerId, id -> ConcurrentHashMap.newKeySet()).addAll(urls);
    }

    /**
     * Classify links; an imported link is {@link LinkStatus#IMPORTED} even if also seen.
     *
     * @param providerId provider the links belong to
     * @param urls       recipe URLs
     * @return status per URL, in input order
     */
    public Map<String, LinkStatus> statuses(String providerId, Collection<String> urls) {
        Set<String> imported = catalog.importedSourceUrls(providerId);
        Set<String> seen = seenByProvider.getOrDefault(providerId, Set.of());
        Map<String, LinkStatus> result = new LinkedHashMap<>();
        for (String url : urls) {
            if (imported.contains(url)) {
                result.put(url, LinkStatus.IMPORTED);
            } else if (seen.contains(url)) {
                result.put(url, LinkStatus.SEEN);
            } else {
                result.put(url, LinkStatus.FRESH);
            }
        }
        return result;
    }

    /**
     * Drop already imported links when {@code hideImported} is set.
     *
     * @param providerId   provider the links belong to
     * @param urls         recipe URLs
     * @param hideImported whether to filter
     * @return the kept URLs, in input order
     */
    public List<String> visible(String providerId, Collection<String> urls, boolean hideImported) {
        if (!hideImported) {
            return List.copyOf(urls);
        }
        Set<String> imported = catalog.importedSourceUrls(providerId);
        return urls.stream().filter(url -> !imported.contains(url)).toList();
    }
}
