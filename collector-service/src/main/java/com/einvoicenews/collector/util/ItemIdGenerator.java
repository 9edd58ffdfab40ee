package com.einvoicenews.collector.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Deterministic item ids: {sourceId}-{yyyy-MM-dd}-{hash8}, or {sourceId}-{hash8} without a date.
 * The day is taken in UTC and the hash is over the trimmed, lower-cased URL, so the same item
 * fetched twice on one day keeps its id across processes.
 */
public final class ItemIdGenerator {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private ItemIdGenerator() {}

    public static String generate(String sourceId, String url, Instant publishedAt) {
        String urlHash = Digests.md5Hex(TextNormalizer.key(url)).substring(0, 8);
        if (publishedAt != null) {
            return sourceId + "-" + DAY.format(publishedAt) + "-" + urlHash;
        }
        return sourceId + "-" + urlHash;
    }
}
