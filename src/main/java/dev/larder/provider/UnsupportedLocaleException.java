package dev.larder.provider;

import java.util.Collection;

/**
 * Raised when a provider has no site edition for the configured language.
 */
public class UnsupportedLocaleException extends RuntimeException {

    private final String providerId;
    private final String language;

    public UnsupportedLocaleException(String providerName, String providerId, String language,
                                      Collection<String> supportedLanguages) {
        super(providerName + " is not available for language \"" + language
                + "\". Supported languages: " + String.join(", ", supportedLanguages));
        this.providerId = providerId;
        this.language = language;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getLanguage() {
        return language;
    }
}
