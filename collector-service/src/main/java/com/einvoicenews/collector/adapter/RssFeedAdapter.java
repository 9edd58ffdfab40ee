package com.einvoicenews.collector.adapter;

import com.einvoicenews.collector.client.FetchResult;
import com.einvoicenews.collector.client.RateLimitedFetcher;
import com.einvoicenews.collector.config.SourcesConfig.SourceDefinition;
import com.einvoicenews.collector.entity.Item;
import com.einvoicenews.collector.exception.SourceAdapterException;
import com.einvoicenews.collector.util.TextNormalizer;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import lombok.extern.slf4j.Slf4j;

import java.io.StringReader;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Reads RSS and Atom feeds with Rome.
 */
@Slf4j
public class RssFeedAdapter extends AbstractSourceAdapter {

    public RssFeedAdapter(SourceDefinition definition, RateLimitedFetcher fetcher, ItemFactory itemFactory) {
        super(definition, fetcher, itemFactory);
    }

    @Override
    public List<Item> produceItems() {
        List<Item> items = new ArrayList<>();
        List<String> urls = definition.getUrls();
        Exception lastFailure = null;
        int loaded = 0;

        for (String feedUrl : urls) {
            FetchResult result = fetcher.fetch(feedUrl);
            if (!result.isSuccess()) {
                lastFailure = result.error();
                continue;
            }
            try {
                items.addAll(parseFeed(result.body()));
                loaded++;
            } catch (FeedException | IllegalArgumentException e) {
                log.warn("{}: Invalid feed at {}: {}", sourceName(), feedUrl, e.getMessage());
                lastFailure = e;
            }
        }

        if (loaded == 0 && lastFailure != null) {
            throw new SourceAdapterException(sourceId(),
                    "None of " + urls.size() + " feeds could be read", lastFailure);
        }
        return items;
    }

    List<Item> parseFeed(String xml) throws FeedException {
        SyndFeed feed = new SyndFeedInput().build(new StringReader(xml));
        log.info("{}: Found {} entries in feed", sourceName(), feed.getEntries().size());

        List<Item> items = new ArrayList<>();
        for (SyndEntry entry : feed.getEntries()) {
            if (items.size() >= definition.getMaxItems()) {
                break;
            }
            Item item = parseEntry(entry);
            if (item != null) {
                items.add(item);
            }
        }
        return items;
    }

    private Item parseEntry(SyndEntry entry) {
        String title = TextNormalizer.clean(entry.getTitle());
        String link = entry.getLink() != null ? entry.getLink().strip() : "";
        if (title.length() < definition.getMinTitleLength() || link.isEmpty()) {
            log.debug("{}: Skipping entry without usable title or link: {}", sourceName(), title);
            return null;
        }

        String summary = entry.getDescription() != null
                ? TextNormalizer.htmlToText(entry.getDescription().getValue())
                : "";
        if (!isRelevant(title, summary)) {
            return null;
        }

        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        Instant publishedAt = date != null ? date.toInstant() : null;
        return itemFactory.create(title, summary, link, publishedAt);
    }
}
