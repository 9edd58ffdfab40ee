package com.einvoicenews.collector.exception;

/**
 * A single page fetch failed. Reported by the fetcher, handled by the adapter that issued it.
 */
public class FetchException extends CollectorException {

    private final String url;
    private final Integer statusCode;

    public FetchException(String url, String message) {
        this(url, message, null, null);
    }

    public FetchException(String url, String message, Integer statusCode, Throwable cause) {
        super("FETCH_ERROR", message, cause);
        this.url = url;
        this.statusCode = statusCode;
    }

    public static FetchException httpStatus(String url, int statusCode) {
        return new FetchException(url, "HTTP " + statusCode + " from " + url, statusCode, null);
    }

    public static FetchException timeout(String url, long timeoutMillis) {
        return new FetchException(url, "Timed out after " + timeoutMillis + "ms fetching " + url, null, null);
    }

    public static FetchException transport(String url, Throwable cause) {
        return new FetchException(url, "Failed to fetch " + url + ": " + cause.getMessage(), null, cause);
    }

    public static FetchException interrupted(String url) {
        return new FetchException(url, "Interrupted while waiting for rate limit: " + url);
    }

    public String getUrl() {
        return url;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
