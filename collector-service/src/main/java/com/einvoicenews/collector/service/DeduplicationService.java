package com.einvoicenews.collector.service;

import com.einvoicenews.collector.config.CollectorProperties;
import com.einvoicenews.collector.entity.Item;
import com.einvoicenews.collector.util.Digests;
import com.einvoicenews.collector.util.SequenceSimilarity;
import com.einvoicenews.collector.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Order-preserving duplicate removal. An item is dropped when an earlier kept item has the same
 * normalized URL, the same title/URL fingerprint, or a title at least as similar as the
 * configured threshold.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeduplicationService {

    private final CollectorProperties properties;

    public List<Item> deduplicate(List<Item> items) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        double threshold = properties.getSimilarityThreshold();

        Set<String> seenUrls = new HashSet<>();
        Set<String> seenFingerprints = new HashSet<>();
        List<String> keptTitles = new ArrayList<>();
        List<Item> unique = new ArrayList<>();
        int urlDuplicates = 0;
        int fingerprintDuplicates = 0;
        int similarDuplicates = 0;

        for (Item item : items) {
            if (item == null) {
                continue;
            }
            String url = TextNormalizer.key(item.getUrl());
            if (seenUrls.contains(url)) {
                urlDuplicates++;
                continue;
            }

            String title = TextNormalizer.key(item.getTitle());
            String fingerprint = fingerprint(title, url);
            if (seenFingerprints.contains(fingerprint)) {
                fingerprintDuplicates++;
                continue;
            }

            if (hasSimilarTitle(title, keptTitles, threshold)) {
                similarDuplicates++;
                log.debug("Similar title dropped: {}", item.getTitle());
                continue;
            }

            seenUrls.add(url);
            seenFingerprints.add(fingerprint);
            keptTitles.add(title);
            unique.add(item);
        }

        int removed = urlDuplicates + fingerprintDuplicates + similarDuplicates;
        if (removed > 0) {
            log.info("Removed {} duplicates ({} by URL, {} by fingerprint, {} by similar title)",
                    removed, urlDuplicates, fingerprintDuplicates, similarDuplicates);
        }
        return unique;
    }

    /**
     * MD5 of the normalized title and URL joined with "|".
     */
    public static String fingerprint(String normalizedTitle, String normalizedUrl) {
        return Digests.md5Hex(normalizedTitle + "|" + normalizedUrl);
    }

    private boolean hasSimilarTitle(String title, List<String> keptTitles, double threshold) {
        for (String kept : keptTitles) {
            if (SequenceSimilarity.isAtLeast(title, kept, threshold)) {
                return true;
            }
        }
        return false;
    }
}
