package dev.larder.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class RestClientPageFetcherTest {

    private static final String PAGE_URL = "https://www.example.com/recettes/gratin";

    private MockRestServiceServer server;
    private RestClientPageFetcher fetcher;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        fetcher = new RestClientPageFetcher(builder.build());
    }

    @Test
    void fetchReturnsResponseBody() {
        server.expect(requestTo(PAGE_URL))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("<html><body>Gratin</body></html>", MediaType.TEXT_HTML));

        String body = fetcher.fetch(PAGE_URL, CancellationSignal.none());

        assertThat(body).contains("Gratin");
        server.verify();
    }

    @Test
    void fetchEmptyBodyReturnsEmptyString() {
        server.expect(requestTo(PAGE_URL)).andRespond(withStatus(HttpStatus.NO_CONTENT));

        assertThat(fetcher.fetch(PAGE_URL, CancellationSignal.none())).isEmpty();
    }

    @Test
    void fetchNotFoundCarriesStatusCode() {
        server.expect(requestTo(PAGE_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> fetcher.fetch(PAGE_URL, CancellationSignal.none()))
                .isInstanceOfSatisfying(FetchFailureException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(404);
                    assertThat(e.isCancelled()).isFalse();
                    assertThat(e.getUrl()).isEqualTo(PAGE_URL);
                });
    }

    @Test
    void fetchServerErrorCarriesStatusCode() {
        server.expect(requestTo(PAGE_URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> fetcher.fetch(PAGE_URL, CancellationSignal.none()))
                .isInstanceOfSatisfying(FetchFailureException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(503));
    }

    @Test
    void fetchWithCancelledSignalSendsNoRequest() {
        assertThatThrownBy(() -> fetcher.fetch(PAGE_URL, CancellationSignal.cancelledSignal()))
                .isInstanceOfSatisfying(FetchFailureException.class,
                        e -> assertThat(e.isCancelled()).isTrue());

        server.verify();
    }

    @Test
    void fetchMalformedUrlIsNetworkFailure() {
        assertThatThrownBy(() -> fetcher.fetch("https://www.example.com/a b", CancellationSignal.none()))
                .isInstanceOfSatisfying(FetchFailureException.class, e -> {
                    assertThat(e.getStatusCode()).isZero();
                    assertThat(e.isCancelled()).isFalse();
                    assertThat(e.getCause()).isInstanceOf(IllegalArgumentException.class);
                });
    }
}
