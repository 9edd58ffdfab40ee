package com.einvoicenews.collector.adapter;

import com.einvoicenews.collector.client.RateLimitedFetcher;
import com.einvoicenews.collector.client.RateLimitedFetcherFactory;
import com.einvoicenews.collector.config.CollectorProperties;
import com.einvoicenews.collector.config.SourcesConfig;
import com.einvoicenews.collector.config.SourcesConfig.SourceDefinition;
import com.einvoicenews.collector.util.PublishedDateParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the configured source definitions into adapters, once, at startup.
 */
@Slf4j
@Component
public class SourceAdapterRegistry {

    private final List<SourceAdapter> adapters;

    public SourceAdapterRegistry(SourcesConfig sourcesConfig,
                                 RateLimitedFetcherFactory fetcherFactory,
                                 CollectorProperties properties,
                                 Clock clock) {
        PublishedDateParser dateParser = new PublishedDateParser(clock);
        Set<String> ids = new HashSet<>();
        List<SourceAdapter> built = new ArrayList<>();

        for (SourceDefinition definition : sourcesConfig.getSources()) {
            if (!definition.isEnabled()) {
                log.info("Source disabled: {}", definition.getId());
                continue;
            }
            if (!ids.add(definition.getId())) {
                throw new IllegalStateException("Duplicate source id: " + definition.getId());
            }
            RateLimitedFetcher fetcher = fetcherFactory.create(definition.getId());
            ItemFactory itemFactory = new ItemFactory(definition, clock, properties.getSummaryMaxLength());
            built.add(switch (definition.getType()) {
                case LISTING -> new ListingPageAdapter(definition, fetcher, itemFactory, dateParser);
                case RSS -> new RssFeedAdapter(definition, fetcher, itemFactory);
                case PAGE -> new CompliancePageAdapter(definition, fetcher, itemFactory);
            });
        }

        this.adapters = List.copyOf(built);
        log.info("Registered {} source adapters", adapters.size());
    }

    public List<SourceAdapter> getAdapters() {
        return adapters;
    }
}
