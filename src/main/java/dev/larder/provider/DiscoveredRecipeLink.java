package dev.larder.provider;

import org.jspecify.annotations.Nullable;

/**
 * Candidate recipe found on a listing page. The URL is the identity of a link within one
 * discovery run.
 *
 * @param url      absolute recipe page URL
 * @param title    display title derived from the URL slug, empty when unknown
 * @param imageUrl thumbnail URL, filled in later by image enrichment
 */
public record DiscoveredRecipeLink(String url, String title, @Nullable String imageUrl) {

    public DiscoveredRecipeLink {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        title = title == null ? "" : title;
    }

    public static DiscoveredRecipeLink of(String url, String title) {
        return new DiscoveredRecipeLink(url, title, null);
    }

    public DiscoveredRecipeLink withImageUrl(String imageUrl) {
        return new DiscoveredRecipeLink(url, title, imageUrl);
    }

    public boolean hasImage() {
        return imageUrl != null && !imageUrl.isBlank();
    }
}
