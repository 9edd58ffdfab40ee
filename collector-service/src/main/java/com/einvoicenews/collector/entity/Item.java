package com.einvoicenews.collector.entity;

import com.einvoicenews.collector.util.ContentCategorizer;
import com.einvoicenews.collector.util.LenientInstantDeserializer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * One aggregated news item. Instances are immutable; the orchestrator derives a stamped copy
 * through {@link #withCrawledAt(Instant)}.
 * <p>
 * Categories are distinct, non-blank and at most two, held in an unmodifiable copy. This holds for
 * every built item, including ones read back from the corpus file.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Item {

    String id;

    String title;

    String summary;

    String url;

    ItemSource source;

    String region;

    String country;

    String countryName;

    List<String> categories;

    @JsonDeserialize(using = LenientInstantDeserializer.class)
    Instant publishedAt;

    @With
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    Instant crawledAt;

    public String sourceId() {
        return source != null ? source.id() : null;
    }

    public static class ItemBuilder {

        public ItemBuilder categories(List<String> categories) {
            this.categories = List.copyOf(ContentCategorizer.sanitize(categories));
            return this;
        }

        public Item build() {
            return new Item(id, title, summary, url, source, region, country, countryName,
                    categories != null ? categories : List.of(), publishedAt, crawledAt);
        }
    }
}
