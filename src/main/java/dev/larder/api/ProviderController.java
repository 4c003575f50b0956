package dev.larder.api;

import java.util.List;
import java.util.Set;

import dev.larder.provider.ProviderRegistry;
import dev.larder.provider.RecipeProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/providers")
public class ProviderController {

    private final ProviderRegistry registry;

    public ProviderController(ProviderRegistry registry) {
        this.registry = registry;
    }

    /**
     * Providers with a site edition for the configured language.
     */
    @GetMapping
    public List<ProviderView> providers() {
        return registry.availableProviders().stream()
                .map(ProviderView::of)
                .toList();
    }

    public record ProviderView(String id, String displayName, String logoUrl, Set<String> supportedLanguages) {

        static ProviderView of(RecipeProvider provider) {
            return new ProviderView(provider.id(), provider.displayName(), provider.logoUrl(),
                    provider.supportedLanguages());
        }
    }
}
