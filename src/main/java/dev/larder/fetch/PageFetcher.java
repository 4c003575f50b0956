package dev.larder.fetch;

/**
 * Retrieves the HTML of a web page.
 */
public interface PageFetcher {

    /**
     * Fetch a page body.
     *
     * @param url    absolute page URL
     * @param signal checked before the request is issued
     * @return the response body, never null
     * @throws FetchFailureException on non-2xx status, network failure, or cancellation
     */
    String fetch(String url, CancellationSignal signal);
}
