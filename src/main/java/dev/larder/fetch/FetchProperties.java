package dev.larder.fetch;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "larder.fetch")
public record FetchProperties(
        String userAgent,
        String acceptLanguage,
        int connectTimeoutMs,
        int readTimeoutMs,
        Retry retry
) {
    public record Retry(int maxAttempts, long delayMs, double multiplier) {}
}
