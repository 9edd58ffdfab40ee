package com.einvoicenews.collector.service;

import com.einvoicenews.collector.entity.Item;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class CorpusMergeService {

    // newest first, undated last
    private static final Comparator<Item> NEWEST_FIRST = Comparator.<Item, Instant>comparing(
            Item::getPublishedAt, Comparator.<Instant>nullsFirst(Comparator.naturalOrder())).reversed();

    private final DeduplicationService deduplicationService;

    /**
     * Fresh items go first so they win duplicate ties against stored ones. The result is
     * deduplicated, sorted newest first (stable) and cut to {@code maxSize}.
     */
    public List<Item> merge(List<Item> newItems, List<Item> existingItems, int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        List<Item> combined = new ArrayList<>();
        if (newItems != null) {
            combined.addAll(newItems);
        }
        if (existingItems != null) {
            combined.addAll(existingItems);
        }

        List<Item> unique = new ArrayList<>(deduplicationService.deduplicate(combined));
        unique.sort(NEWEST_FIRST);

        List<Item> merged = unique.size() > maxSize ? unique.subList(0, maxSize) : unique;
        log.info("Merged {} new and {} existing items into {} (limit {})",
                newItems != null ? newItems.size() : 0,
                existingItems != null ? existingItems.size() : 0,
                merged.size(), maxSize);
        return List.copyOf(merged);
    }
}
