package dev.larder.fetch;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to download recipe and listing pages.
 *
 * <p>Timeouts and identification headers are externalized via {@code larder.fetch.*} properties.
 * The client is qualified as {@code "pageRestClient"}.
 */
@Configuration
@EnableRetry
public class FetchConfig {

    /**
     * Creates the page-fetching {@link RestClient}.
     *
     * @param builder    Spring-provided builder with common defaults
     * @param properties user agent, language preference and timeouts
     * @return a named REST client bean for injection into {@link RestClientPageFetcher}
     */
    @Bean
    public RestClient pageRestClient(RestClient.Builder builder, FetchProperties properties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

        return builder
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, properties.userAgent())
                .defaultHeader(HttpHeaders.ACCEPT,
                        "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, properties.acceptLanguage())
                .build();
    }
}
