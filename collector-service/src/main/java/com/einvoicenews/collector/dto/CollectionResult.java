package com.einvoicenews.collector.dto;

import com.einvoicenews.collector.entity.Item;

import java.util.List;

/**
 * Items gathered from all adapters in completion order, plus one outcome per adapter.
 */
public record CollectionResult(List<Item> items, List<AdapterOutcome> outcomes) {

    public CollectionResult {
        items = items != null ? List.copyOf(items) : List.of();
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
    }

    public static CollectionResult empty() {
        return new CollectionResult(List.of(), List.of());
    }

    public long failedSources() {
        return outcomes.stream().filter(AdapterOutcome::isFailed).count();
    }
}
