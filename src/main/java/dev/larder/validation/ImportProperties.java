package dev.larder.validation;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param finishedSessionRetention how long a completed or failed import stays readable before it
 *                                 is evicted
 */
@ConfigurationProperties(prefix = "larder.imports")
public record ImportProperties(Duration finishedSessionRetention) {

    public ImportProperties {
        if (finishedSessionRetention == null || finishedSessionRetention.isNegative()) {
            throw new IllegalArgumentException("finishedSessionRetention must not be negative");
        }
    }
}
