package dev.larder.fetch;

import java.net.URI;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class RestClientPageFetcher implements PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(RestClientPageFetcher.class);

    private final RestClient restClient;

    public RestClientPageFetcher(@Qualifier("pageRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * Fetch a page over HTTP GET.
     * Retries on transient I/O errors (connection refused, timeouts) with exponential backoff;
     * error statuses are not retried.
     */
    @Override
    @Retryable(
            retryFor = ResourceAccessException.class,
            maxAttemptsExpression = "${larder.fetch.retry.max-attempts}",
            backoff = @Backoff(
                    delayExpression = "${larder.fetch.retry.delay-ms}",
                    multiplierExpression = "${larder.fetch.retry.multiplier}"
            )
    )
    public String fetch(String url, CancellationSignal signal) {
        if (signal.isCancelled()) {
            throw FetchFailureException.cancelled(url);
        }

        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw FetchFailureException.network(url, e);
        }

        try {
            String body = restClient.get()
                    .uri(uri)
                    .retrieve()
                    .body(String.class);
            return body == null ? "" : body;
        } catch (RestClientResponseException e) {
            throw FetchFailureException.httpStatus(url, e.getStatusCode().value(), e.getStatusText());
        }
    }

    @Recover
    String recoverFetch(RuntimeException e, String url, CancellationSignal signal) {
        if (e instanceof FetchFailureException failure) {
            throw failure;
        }
        log.warn("Page fetch failed after retries for {}: {}", url, e.getMessage());
        throw FetchFailureException.network(url, e);
    }
}
