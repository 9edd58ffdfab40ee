package com.einvoicenews.collector.adapter;

import com.einvoicenews.collector.client.FetchResult;
import com.einvoicenews.collector.client.RateLimitedFetcher;
import com.einvoicenews.collector.config.SourcesConfig.SourceDefinition;
import com.einvoicenews.collector.entity.Item;
import com.einvoicenews.collector.exception.SourceAdapterException;
import com.einvoicenews.collector.util.PublishedDateParser;
import com.einvoicenews.collector.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scrapes HTML listing pages with CSS selectors. Every configured page is fetched and parsed;
 * a page that fails to load is skipped.
 */
@Slf4j
public class ListingPageAdapter extends AbstractSourceAdapter {

    private final PublishedDateParser dateParser;

    public ListingPageAdapter(SourceDefinition definition, RateLimitedFetcher fetcher,
                              ItemFactory itemFactory, PublishedDateParser dateParser) {
        super(definition, fetcher, itemFactory);
        this.dateParser = dateParser;
    }

    @Override
    public List<Item> produceItems() {
        List<Item> items = new ArrayList<>();
        List<String> urls = definition.getUrls();
        FetchResult lastFailure = null;
        int loaded = 0;

        for (String pageUrl : urls) {
            FetchResult result = fetcher.fetch(pageUrl);
            if (!result.isSuccess()) {
                lastFailure = result;
                continue;
            }
            loaded++;
            List<Item> pageItems = parsePage(pageUrl, result.body());
            log.debug("{}: {} items on {}", sourceName(), pageItems.size(), pageUrl);
            items.addAll(pageItems);
        }

        if (loaded == 0 && lastFailure != null) {
            throw new SourceAdapterException(sourceId(),
                    "None of " + urls.size() + " listing pages could be loaded", lastFailure.error());
        }
        return items;
    }

    List<Item> parsePage(String pageUrl, String html) {
        Document doc = Jsoup.parse(html, pageUrl);
        Elements elements = selectItemElements(doc);
        List<Item> items = new ArrayList<>();

        for (Element element : elements) {
            if (items.size() >= definition.getMaxItems()) {
                break;
            }
            try {
                toItem(element).ifPresent(items::add);
            } catch (RuntimeException e) {
                log.debug("{}: Skipping unparseable element: {}", sourceName(), e.getMessage());
            }
        }
        return items;
    }

    private Elements selectItemElements(Document doc) {
        for (String selector : definition.getItemSelectors()) {
            Elements found = doc.select(selector);
            if (!found.isEmpty()) {
                return found;
            }
        }
        return new Elements();
    }

    private Optional<Item> toItem(Element element) {
        Element titleElement = element.selectFirst(definition.getTitleSelector());
        if (titleElement == null) {
            return Optional.empty();
        }
        String title = TextNormalizer.clean(titleElement.text());
        if (title.length() < definition.getMinTitleLength()) {
            return Optional.empty();
        }

        String url = extractUrl(element, titleElement);
        if (url.isEmpty()) {
            return Optional.empty();
        }

        Element summaryElement = element.selectFirst(definition.getSummarySelector());
        String summary = summaryElement != null && summaryElement != titleElement
                ? TextNormalizer.clean(summaryElement.text())
                : "";

        if (!isRelevant(title, summary)) {
            return Optional.empty();
        }

        return Optional.of(itemFactory.create(title, summary, url, extractDate(element)));
    }

    // Resolved against the page URL. Hrefs Jsoup cannot resolve are passed through raw
    // so the orchestrator's URL check reports them.
    private String extractUrl(Element element, Element titleElement) {
        Element link = titleElement.hasAttr("href") ? titleElement : element.selectFirst(definition.getLinkSelector());
        if (link == null) {
            return "";
        }
        String absolute = link.absUrl("href");
        return !absolute.isEmpty() ? absolute : link.attr("href").strip();
    }

    private Instant extractDate(Element element) {
        Element dateElement = element.selectFirst(definition.getDateSelector());
        if (dateElement == null) {
            return null;
        }
        String raw = dateElement.hasAttr("datetime") ? dateElement.attr("datetime") : dateElement.text();
        return dateParser.parse(raw).orElse(null);
    }
}
