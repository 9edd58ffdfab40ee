package com.einvoicenews.collector.service;

import com.einvoicenews.collector.adapter.SourceAdapter;
import com.einvoicenews.collector.dto.AdapterOutcome;
import com.einvoicenews.collector.dto.CollectionResult;
import com.einvoicenews.collector.entity.Item;
import com.einvoicenews.collector.exception.CollectorException;
import com.einvoicenews.collector.util.ItemIdGenerator;
import com.einvoicenews.collector.util.UrlValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;

/**
 * Runs every adapter on the collection pool and gathers results as they complete.
 * One adapter failing, by exception or by error, never affects the others. An interrupt of the
 * collecting thread cancels the unfinished adapters and fails the whole collection.
 */
@Slf4j
@Service
public class CollectionOrchestrator {

    private final Executor collectionExecutor;
    private final Clock clock;

    public CollectionOrchestrator(@Qualifier("collectionExecutor") Executor collectionExecutor, Clock clock) {
        this.collectionExecutor = collectionExecutor;
        this.clock = clock;
    }

    public CollectionResult collect(List<SourceAdapter> adapters) {
        if (adapters == null || adapters.isEmpty()) {
            log.warn("No source adapters registered");
            return CollectionResult.empty();
        }

        CompletionService<AdapterRun> completionService = new ExecutorCompletionService<>(collectionExecutor);
        Map<Future<AdapterRun>, SourceAdapter> pending = new IdentityHashMap<>();
        for (SourceAdapter adapter : adapters) {
            pending.put(completionService.submit(() -> runAdapter(adapter)), adapter);
        }

        List<Item> items = new ArrayList<>();
        List<AdapterOutcome> outcomes = new ArrayList<>();
        try {
            for (int i = 0; i < adapters.size(); i++) {
                Future<AdapterRun> future = completionService.take();
                SourceAdapter adapter = pending.remove(future);
                AdapterRun run;
                try {
                    run = future.get();
                } catch (ExecutionException e) {
                    log.error("{}: Adapter task aborted - {}", adapter.sourceName(), String.valueOf(e.getCause()), e.getCause());
                    run = new AdapterRun(List.of(), AdapterOutcome.failed(
                            adapter.sourceId(), adapter.sourceName(), e.getCause(), Duration.ZERO));
                }
                items.addAll(run.items());
                outcomes.add(run.outcome());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.keySet().forEach(f -> f.cancel(true));
            throw new CollectorException("COLLECTION_INTERRUPTED",
                    "Collection interrupted with " + outcomes.size() + " of " + adapters.size() + " sources finished", e);
        }

        log.info("Collection finished: {} items from {} sources", items.size(), outcomes.size());
        return new CollectionResult(items, outcomes);
    }

    private AdapterRun runAdapter(SourceAdapter adapter) {
        long start = System.nanoTime();
        log.info("Starting {}...", adapter.sourceName());
        try {
            List<Item> produced = adapter.produceItems();
            if (produced == null) {
                produced = List.of();
            }
            Instant collectedAt = clock.instant();

            List<Item> accepted = new ArrayList<>(produced.size());
            for (Item item : produced) {
                if (item == null) {
                    continue;
                }
                if (!UrlValidator.isValid(item.getUrl())) {
                    log.warn("{}: Skipping item with invalid URL: {}", adapter.sourceName(), item.getUrl());
                    continue;
                }
                accepted.add(stamp(adapter, item, collectedAt));
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.info("{}: Found {} valid items ({} rejected) in {}ms",
                    adapter.sourceName(), accepted.size(), produced.size() - accepted.size(), elapsed.toMillis());
            return new AdapterRun(accepted, AdapterOutcome.succeeded(
                    adapter.sourceId(), adapter.sourceName(), produced.size(), accepted.size(), elapsed));
        } catch (Exception e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.error("{}: Collection failed - {}", adapter.sourceName(), e.getMessage(), e);
            return new AdapterRun(List.of(), AdapterOutcome.failed(
                    adapter.sourceId(), adapter.sourceName(), e, elapsed));
        }
    }

    private Item stamp(SourceAdapter adapter, Item item, Instant collectedAt) {
        Item.ItemBuilder builder = item.toBuilder().crawledAt(collectedAt);
        if (item.getId() == null || item.getId().isBlank()) {
            builder.id(ItemIdGenerator.generate(adapter.sourceId(), item.getUrl(), item.getPublishedAt()));
        }
        return builder.build();
    }

    private record AdapterRun(List<Item> items, AdapterOutcome outcome) {}
}
