package com.einvoicenews.collector.adapter;

import com.einvoicenews.collector.client.RateLimitedFetcher;
import com.einvoicenews.collector.config.SourcesConfig.Relevance;
import com.einvoicenews.collector.config.SourcesConfig.SourceDefinition;
import com.einvoicenews.collector.entity.SourceKind;
import com.einvoicenews.collector.util.RelevanceFilter;

/**
 * Shared plumbing for configured adapters: identity, fetcher, item factory and relevance check.
 */
public abstract class AbstractSourceAdapter implements SourceAdapter {

    protected final SourceDefinition definition;
    protected final RateLimitedFetcher fetcher;
    protected final ItemFactory itemFactory;

    protected AbstractSourceAdapter(SourceDefinition definition, RateLimitedFetcher fetcher, ItemFactory itemFactory) {
        this.definition = definition;
        this.fetcher = fetcher;
        this.itemFactory = itemFactory;
    }

    @Override
    public String sourceId() {
        return definition.getId();
    }

    @Override
    public String sourceName() {
        return definition.getName();
    }

    @Override
    public SourceKind sourceKind() {
        return definition.getKind();
    }

    protected boolean isRelevant(String title, String summary) {
        Relevance relevance = definition.getRelevance() != null ? definition.getRelevance() : Relevance.EINVOICE;
        return switch (relevance) {
            case NONE -> true;
            case KEYWORDS -> definition.getKeywords() == null || definition.getKeywords().isEmpty()
                    ? RelevanceFilter.isEInvoiceRelated(title, summary)
                    : RelevanceFilter.containsAny(title, summary, definition.getKeywords());
            case EINVOICE -> RelevanceFilter.isEInvoiceRelated(title, summary);
        };
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + sourceId() + "]";
    }
}
