package com.einvoicenews.collector.adapter;

import com.einvoicenews.collector.config.SourcesConfig.SourceDefinition;
import com.einvoicenews.collector.entity.Item;
import com.einvoicenews.collector.entity.ItemSource;
import com.einvoicenews.collector.util.ContentCategorizer;
import com.einvoicenews.collector.util.CountryDetector;
import com.einvoicenews.collector.util.CountryDetector.CountryMatch;
import com.einvoicenews.collector.util.ItemIdGenerator;
import com.einvoicenews.collector.util.TextNormalizer;

import java.time.Clock;
import java.time.Instant;

/**
 * Builds items for one source: cleans text, derives id and categories, fills in defaults.
 */
public class ItemFactory {

    private final SourceDefinition definition;
    private final ItemSource itemSource;
    private final Clock clock;
    private final int summaryMaxLength;

    public ItemFactory(SourceDefinition definition, Clock clock, int summaryMaxLength) {
        this.definition = definition;
        this.itemSource = new ItemSource(definition.getId(), definition.getName(), definition.getKind());
        this.clock = clock;
        this.summaryMaxLength = summaryMaxLength;
    }

    /**
     * @param publishedAt publication time, or null when the page did not show one
     */
    public Item create(String title, String summary, String url, Instant publishedAt) {
        String cleanTitle = TextNormalizer.clean(title);
        String cleanSummary = TextNormalizer.clean(summary);
        if (cleanSummary.isEmpty()) {
            cleanSummary = cleanTitle;
        }
        cleanSummary = TextNormalizer.truncate(cleanSummary, summaryMaxLength);

        Instant published = publishedAt != null ? publishedAt : clock.instant();

        Item.ItemBuilder builder = Item.builder()
                .id(ItemIdGenerator.generate(itemSource.id(), url, published))
                .title(cleanTitle)
                .summary(cleanSummary)
                .url(url)
                .source(itemSource)
                .categories(ContentCategorizer.categorize(cleanTitle, cleanSummary))
                .publishedAt(published);

        if (definition.isDetectCountry()) {
            CountryMatch match = CountryDetector.detect(cleanTitle, cleanSummary);
            builder.region(match.region())
                    .country(match.country())
                    .countryName(match.countryName());
        } else {
            builder.region(definition.getRegion() != null ? definition.getRegion() : "global")
                    .country(definition.getCountry())
                    .countryName(definition.getCountryName());
        }
        return builder.build();
    }
}
