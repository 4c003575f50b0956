package dev.larder.discovery;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param emptyPageRetries retry rounds for listing pages that came back empty before the last
 *                         non-empty one
 * @param retryDelayMs     base delay between retry rounds, multiplied by the round number
 */
@ConfigurationProperties(prefix = "larder.discovery")
public record DiscoveryProperties(int emptyPageRetries, long retryDelayMs) {

    public DiscoveryProperties {
        if (emptyPageRetries < 0) {
            throw new IllegalArgumentException("emptyPageRetries must not be negative");
        }
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException("retryDelayMs must not be negative");
        }
    }
}
