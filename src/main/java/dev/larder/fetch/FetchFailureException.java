package dev.larder.fetch;

/**
 * Raised when a page could not be retrieved: network error, non-2xx response, or a cancelled
 * signal observed before the request was sent.
 */
public class FetchFailureException extends RuntimeException {

    private final String url;
    private final int statusCode;
    private final boolean cancelled;

    private FetchFailureException(String url, String message, int statusCode, boolean cancelled,
                                  Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = statusCode;
        this.cancelled = cancelled;
    }

    public static FetchFailureException httpStatus(String url, int statusCode, String statusText) {
        return new FetchFailureException(url, "HTTP " + statusCode + ": " + statusText,
                statusCode, false, null);
    }

    public static FetchFailureException network(String url, Throwable cause) {
        return new FetchFailureException(url, "Could not fetch " + url + ": " + cause.getMessage(),
                0, false, cause);
    }

    public static FetchFailureException cancelled(String url) {
        return new FetchFailureException(url, "Fetch cancelled: " + url, 0, true, null);
    }

    public String getUrl() {
        return url;
    }

    /**
     * @return the HTTP status of the response, 0 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
