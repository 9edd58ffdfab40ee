package com.einvoicenews.collector.adapter;

import com.einvoicenews.collector.client.FetchResult;
import com.einvoicenews.collector.client.RateLimitedFetcher;
import com.einvoicenews.collector.config.SourcesConfig.PageTarget;
import com.einvoicenews.collector.config.SourcesConfig.SourceDefinition;
import com.einvoicenews.collector.entity.Item;
import com.einvoicenews.collector.exception.SourceAdapterException;
import com.einvoicenews.collector.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads country compliance pages, such as a regulatory atlas, as one item per page. The page
 * heading becomes the title and its opening paragraphs the summary; country and region come
 * from the page's configuration rather than from the text.
 */
@Slf4j
public class CompliancePageAdapter extends AbstractSourceAdapter {

    private static final List<String> CONTENT_SELECTORS = List.of(
            ".content-main", "main", ".page-content", "article", "[class*=content]");
    private static final String HEADING_SELECTOR = "h1, .page-title, .title";
    private static final List<String> DEADLINE_KEYWORDS = List.of(
            "deadline", "effective", "mandatory", "january", "july", "2026", "2027");

    // only the first paragraphs are considered, short ones are skipped
    private static final int SUMMARY_PARAGRAPHS = 3;
    private static final int MIN_PARAGRAPH_LENGTH = 30;
    private static final int SUMMARY_TARGET_LENGTH = 200;

    public CompliancePageAdapter(SourceDefinition definition, RateLimitedFetcher fetcher, ItemFactory itemFactory) {
        super(definition, fetcher, itemFactory);
    }

    @Override
    public List<Item> produceItems() {
        List<Item> items = new ArrayList<>();
        List<PageTarget> pages = definition.getPages();
        FetchResult lastFailure = null;
        int loaded = 0;

        for (PageTarget page : pages) {
            FetchResult result = fetcher.fetch(page.getUrl());
            if (!result.isSuccess()) {
                lastFailure = result;
                continue;
            }
            loaded++;
            try {
                parsePage(page, result.body()).ifPresent(items::add);
            } catch (RuntimeException e) {
                log.debug("{}: Skipping unparseable page {}: {}", sourceName(), page.getUrl(), e.getMessage());
            }
        }

        if (loaded == 0 && lastFailure != null) {
            throw new SourceAdapterException(sourceId(),
                    "None of " + pages.size() + " compliance pages could be loaded", lastFailure.error());
        }
        log.info("{}: Read {} of {} compliance pages", sourceName(), items.size(), pages.size());
        return items;
    }

    Optional<Item> parsePage(PageTarget page, String html) {
        Document doc = Jsoup.parse(html, page.getUrl());
        Element content = selectContent(doc);

        String title = headingOf(content);
        if (title.isEmpty()) {
            title = page.getCountryName() + " E-Invoicing Compliance Update";
        }
        String summary = leadParagraphs(content);
        if (summary.isEmpty()) {
            summary = "E-invoicing regulatory updates and compliance requirements for " + page.getCountryName();
        }

        if (!isRelevant(title, summary)) {
            return Optional.empty();
        }

        boolean mentionsDeadline = DEADLINE_KEYWORDS.stream()
                .anyMatch(summary.toLowerCase(Locale.ROOT)::contains);

        Item item = itemFactory.create(title, summary, page.getUrl(), null).toBuilder()
                .region(page.getRegion() != null ? page.getRegion() : "global")
                .country(page.getCountry())
                .countryName(page.getCountryName())
                .categories(List.of("compliance", mentionsDeadline ? "deadline" : "regulation"))
                .build();
        return Optional.of(item);
    }

    private static Element selectContent(Document doc) {
        for (String selector : CONTENT_SELECTORS) {
            Element found = doc.selectFirst(selector);
            if (found != null) {
                return found;
            }
        }
        return doc;
    }

    private static String headingOf(Element content) {
        Element heading = content.selectFirst(HEADING_SELECTOR);
        return heading != null ? TextNormalizer.clean(heading.text()) : "";
    }

    private static String leadParagraphs(Element content) {
        List<String> parts = new ArrayList<>();
        int length = 0;
        List<Element> paragraphs = content.select("p");
        for (Element paragraph : paragraphs.subList(0, Math.min(SUMMARY_PARAGRAPHS, paragraphs.size()))) {
            String text = TextNormalizer.clean(paragraph.text());
            if (text.length() <= MIN_PARAGRAPH_LENGTH) {
                continue;
            }
            parts.add(text);
            length += text.length() + 1;
            if (length > SUMMARY_TARGET_LENGTH) {
                break;
            }
        }
        return String.join(" ", parts);
    }
}
