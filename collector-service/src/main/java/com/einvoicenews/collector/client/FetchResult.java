package com.einvoicenews.collector.client;

import com.einvoicenews.collector.exception.FetchException;

/**
 * Outcome of one fetch: a body, or the error that prevented it.
 */
public record FetchResult(String url, String body, FetchException error) {

    public static FetchResult success(String url, String body) {
        return new FetchResult(url, body, null);
    }

    public static FetchResult failure(String url, FetchException error) {
        return new FetchResult(url, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
