package com.einvoicenews.collector.service;

import com.einvoicenews.collector.adapter.SourceAdapterRegistry;
import com.einvoicenews.collector.config.CollectorProperties;
import com.einvoicenews.collector.dto.AdapterOutcome;
import com.einvoicenews.collector.dto.CollectionResult;
import com.einvoicenews.collector.dto.RunReport;
import com.einvoicenews.collector.entity.Corpus;
import com.einvoicenews.collector.entity.Item;
import com.einvoicenews.collector.entity.RunStatus;
import com.einvoicenews.collector.exception.CorpusStoreException;
import com.einvoicenews.collector.repository.CorpusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * One complete collection run: load the corpus, collect, merge and persist.
 * <p>
 * A failure after the corpus was loaded rewrites the previous items with a failed status,
 * so the store always says whether the last run worked.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollectionRunService {

    private static final String RULE = "=".repeat(60);

    private final CorpusRepository corpusRepository;
    private final CollectionOrchestrator orchestrator;
    private final CorpusMergeService mergeService;
    private final SourceAdapterRegistry adapterRegistry;
    private final CollectorProperties properties;
    private final Clock clock;

    public RunReport runOnce() {
        long start = System.nanoTime();
        log.info(RULE);
        log.info("Starting news collection at {}", clock.instant());
        log.info(RULE);

        Corpus existing;
        try {
            existing = corpusRepository.read();
        } catch (CorpusStoreException e) {
            log.error("Cannot load corpus from {}, leaving it untouched: {}", e.getLocation(), e.getMessage(), e);
            return finish(RunReport.failed(0, 0, List.of(), elapsedSince(start), e.getMessage()));
        }

        CollectionResult collected = CollectionResult.empty();
        try {
            collected = orchestrator.collect(adapterRegistry.getAdapters());
            log.info("Collected {} items from {} sources ({} failed)",
                    collected.items().size(), collected.outcomes().size(), collected.failedSources());

            List<Item> merged = mergeService.merge(collected.items(), existing.items(), properties.getMaxItems());
            corpusRepository.write(Corpus.of(clock.instant(), RunStatus.SUCCESS, merged));

            return finish(RunReport.success(collected.items().size(), merged.size(),
                    collected.outcomes(), elapsedSince(start)));
        } catch (RuntimeException e) {
            log.error("Collection run failed: {}", e.getMessage(), e);
            recordFailure(existing);
            return finish(RunReport.failed(collected.items().size(), existing.items().size(),
                    collected.outcomes(), elapsedSince(start), e.getMessage()));
        }
    }

    private void recordFailure(Corpus existing) {
        try {
            corpusRepository.write(existing.markFailed(clock.instant()));
        } catch (CorpusStoreException e) {
            log.error("Could not record failed status: {}", e.getMessage(), e);
        }
    }

    private RunReport finish(RunReport report) {
        log.info(RULE);
        log.info("Collection {}: {} new items, {} total, {}ms",
                report.status().getValue(), report.newItems(), report.totalItems(), report.elapsed().toMillis());
        for (AdapterOutcome outcome : report.outcomes()) {
            if (outcome.isFailed()) {
                log.info("  {} - FAILED [{}]: {}", outcome.sourceId(), outcome.errorCode(), outcome.errorMessage());
            } else {
                log.info("  {} - {} items", outcome.sourceId(), outcome.itemsAccepted());
            }
        }
        log.info(RULE);
        return report;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
