package dev.larder.provider;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import dev.larder.schema.ScraperProperties;
import org.springframework.stereotype.Component;

/**
 * Lookup of the registered {@link RecipeProvider} beans by id.
 */
@Component
public class ProviderRegistry {

    private final Map<String, RecipeProvider> providers = new LinkedHashMap<>();
    private final ScraperProperties properties;

    public ProviderRegistry(List<RecipeProvider> providers, ScraperProperties properties) {
        for (RecipeProvider provider : providers) {
            RecipeProvider previous = this.providers.putIfAbsent(provider.id(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider id: " + provider.id());
            }
        }
        this.properties = properties;
    }

    /**
     * @param id provider id
     * @return the provider
     * @throws IllegalArgumentException if no provider has this id
     */
    public RecipeProvider get(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + id));
    }

    public Optional<RecipeProvider> find(String id) {
        return Optional.ofNullable(providers.get(id));
    }

    public boolean contains(String id) {
        return providers.containsKey(id);
    }

    public Collection<RecipeProvider> all() {
        return List.copyOf(providers.values());
    }

    /**
     * Providers having a site edition for the configured language.
     */
    public List<RecipeProvider> availableProviders() {
        return providers.values().stream()
                .filter(provider -> provider.supportsLanguage(properties.language()))
                .toList();
    }
}
