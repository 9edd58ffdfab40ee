package com.einvoicenews.collector.entity;

import com.einvoicenews.collector.util.LenientInstantDeserializer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.Instant;
import java.util.List;

/**
 * Persisted corpus snapshot. Property names follow the news.json layout the web front end reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"lastUpdated", "crawlStatus", "totalArticles", "articles"})
public record Corpus(
        @JsonProperty("lastUpdated")
        @JsonDeserialize(using = LenientInstantDeserializer.class)
        Instant lastUpdated,
        @JsonProperty("crawlStatus") RunStatus runStatus,
        @JsonProperty("totalArticles") int totalItems,
        @JsonProperty("articles") List<Item> items
) {

    public Corpus {
        runStatus = runStatus != null ? runStatus : RunStatus.UNKNOWN;
        items = items != null ? List.copyOf(items) : List.of();
    }

    public static Corpus empty() {
        return new Corpus(null, RunStatus.UNKNOWN, 0, List.of());
    }

    public static Corpus of(Instant lastUpdated, RunStatus runStatus, List<Item> items) {
        return new Corpus(lastUpdated, runStatus, items.size(), items);
    }

    /**
     * Same items, new timestamp and a failed status.
     */
    public Corpus markFailed(Instant now) {
        return new Corpus(now, RunStatus.FAILED, items.size(), items);
    }
}
