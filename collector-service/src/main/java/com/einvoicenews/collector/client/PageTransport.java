package com.einvoicenews.collector.client;

import com.einvoicenews.collector.exception.FetchException;

import java.time.Duration;

/**
 * Performs a single HTTP GET. Implementations do not retry.
 */
public interface PageTransport {

    /**
     * @return the response body of a 2xx response
     * @throws FetchException on a non-2xx status, a timeout or a transport error
     */
    String get(String url, Duration timeout);
}
