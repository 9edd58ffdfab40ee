package com.einvoicenews.collector.client;

import com.einvoicenews.collector.config.CollectorProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Hands each adapter a fetcher with its own limiter so one source's quota never delays another.
 */
@Component
@RequiredArgsConstructor
public class RateLimitedFetcherFactory {

    private final PageTransport pageTransport;
    private final CollectorProperties properties;

    public RateLimitedFetcher create(String ownerId) {
        CollectorProperties.RateLimit rateLimit = properties.getRateLimit();
        SlidingWindowRateLimiter limiter =
                new SlidingWindowRateLimiter(rateLimit.getCalls(), rateLimit.getWindow());
        return new RateLimitedFetcher(ownerId, pageTransport, limiter, properties.getHttp().getTimeout());
    }
}
