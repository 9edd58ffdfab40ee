package com.einvoicenews.collector.client;

import com.einvoicenews.collector.exception.FetchException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Per-adapter page fetcher. Every call first passes the adapter's own rate limiter, then
 * goes to the transport once. Failures come back as a {@link FetchResult}, never thrown.
 */
@Slf4j
public class RateLimitedFetcher {

    private final String ownerId;
    private final PageTransport transport;
    private final SlidingWindowRateLimiter rateLimiter;
    private final Duration defaultTimeout;

    public RateLimitedFetcher(String ownerId, PageTransport transport,
                              SlidingWindowRateLimiter rateLimiter, Duration defaultTimeout) {
        this.ownerId = ownerId;
        this.transport = transport;
        this.rateLimiter = rateLimiter;
        this.defaultTimeout = defaultTimeout;
    }

    public FetchResult fetch(String url) {
        return fetch(url, defaultTimeout);
    }

    public FetchResult fetch(String url, Duration timeout) {
        try {
            Duration waited = rateLimiter.acquire();
            if (!waited.isZero()) {
                log.debug("[{}] Rate limit reached, waited {}ms", ownerId, waited.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(url, FetchException.interrupted(url));
        }

        log.info("[{}] Fetching: {}", ownerId, url);
        try {
            String body = transport.get(url, timeout);
            return FetchResult.success(url, body);
        } catch (FetchException e) {
            log.warn("[{}] {}", ownerId, e.getMessage());
            return FetchResult.failure(url, e);
        } catch (RuntimeException e) {
            log.warn("[{}] Unexpected error fetching {}: {}", ownerId, url, e.getMessage());
            return FetchResult.failure(url, FetchException.transport(url, e));
        }
    }
}
