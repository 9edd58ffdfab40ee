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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.einvoicenews.collector.support.TestItems.item;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CollectionRunServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    @Mock
    private CorpusRepository corpusRepository;

    @Mock
    private CollectionOrchestrator orchestrator;

    @Mock
    private SourceAdapterRegistry adapterRegistry;

    private CollectionRunService runService;

    private final Item stored = item("Stored item about UAE FTA guidance", "https://tax.gov.ae/news/1", "2025-01-01T00:00:00Z");
    private final Item fresh = item("Fresh item about ZATCA wave 14", "https://zatca.gov.sa/news/14", "2025-06-01T00:00:00Z");

    @BeforeEach
    void setUp() {
        CollectorProperties properties = new CollectorProperties();
        CorpusMergeService mergeService = new CorpusMergeService(new DeduplicationService(properties));
        runService = new CollectionRunService(corpusRepository, orchestrator, mergeService, adapterRegistry,
                properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("a successful run stores the merged corpus with a success status")
    void successfulRun() {
        // given
        when(corpusRepository.read()).thenReturn(Corpus.of(NOW.minusSeconds(3600), RunStatus.SUCCESS, List.of(stored)));
        when(adapterRegistry.getAdapters()).thenReturn(List.of());
        when(orchestrator.collect(any())).thenReturn(new CollectionResult(List.of(fresh),
                List.of(AdapterOutcome.succeeded("zatca", "ZATCA", 1, 1, Duration.ofMillis(5)))));

        // when
        RunReport report = runService.runOnce();

        // then
        ArgumentCaptor<Corpus> saved = ArgumentCaptor.forClass(Corpus.class);
        verify(corpusRepository).write(saved.capture());
        assertThat(saved.getValue().runStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(saved.getValue().lastUpdated()).isEqualTo(NOW);
        assertThat(saved.getValue().items()).containsExactly(fresh, stored);
        assertThat(saved.getValue().totalItems()).isEqualTo(2);

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.exitCode()).isZero();
        assertThat(report.newItems()).isEqualTo(1);
        assertThat(report.totalItems()).isEqualTo(2);
    }

    @Test
    @DisplayName("an unreadable corpus fails the run without touching the store")
    void unreadableCorpus() {
        // given
        when(corpusRepository.read()).thenThrow(
                CorpusStoreException.readFailed("data/news.json", new IOException("Unexpected character")));

        // when
        RunReport report = runService.runOnce();

        // then
        assertThat(report.status()).isEqualTo(RunStatus.FAILED);
        assertThat(report.exitCode()).isEqualTo(1);
        verify(corpusRepository, never()).write(any());
        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("a failed write records the previous items with a failed status")
    void writeFailure() {
        // given
        when(corpusRepository.read()).thenReturn(Corpus.of(NOW.minusSeconds(3600), RunStatus.SUCCESS, List.of(stored)));
        when(adapterRegistry.getAdapters()).thenReturn(List.of());
        when(orchestrator.collect(any())).thenReturn(new CollectionResult(List.of(fresh), List.of()));
        doThrow(CorpusStoreException.writeFailed("data/news.json", new IOException("disk full")))
                .doNothing()
                .when(corpusRepository).write(any());

        // when
        RunReport report = runService.runOnce();

        // then
        ArgumentCaptor<Corpus> saved = ArgumentCaptor.forClass(Corpus.class);
        verify(corpusRepository, times(2)).write(saved.capture());
        Corpus marker = saved.getAllValues().get(1);
        assertThat(marker.runStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(marker.items()).containsExactly(stored);
        assertThat(marker.lastUpdated()).isEqualTo(NOW);
        assertThat(report.exitCode()).isEqualTo(1);
    }

    @Test
    @DisplayName("an orchestration failure is recorded the same way")
    void orchestrationFailure() {
        // given
        when(corpusRepository.read()).thenReturn(Corpus.empty());
        when(adapterRegistry.getAdapters()).thenReturn(List.of());
        when(orchestrator.collect(any())).thenThrow(new IllegalStateException("pool shut down"));

        // when
        RunReport report = runService.runOnce();

        // then
        ArgumentCaptor<Corpus> saved = ArgumentCaptor.forClass(Corpus.class);
        verify(corpusRepository).write(saved.capture());
        assertThat(saved.getValue().runStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(saved.getValue().items()).isEmpty();
        assertThat(report.failureMessage()).isEqualTo("pool shut down");
    }

    @Test
    @DisplayName("failing sources alone do not fail the run")
    void failedSourcesStillSucceed() {
        when(corpusRepository.read()).thenReturn(Corpus.empty());
        when(adapterRegistry.getAdapters()).thenReturn(List.of());
        when(orchestrator.collect(any())).thenReturn(new CollectionResult(List.of(),
                List.of(AdapterOutcome.failed("ey", "EY", new IllegalStateException("403"), Duration.ZERO))));

        RunReport report = runService.runOnce();

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.outcomes()).hasSize(1);
    }
}
