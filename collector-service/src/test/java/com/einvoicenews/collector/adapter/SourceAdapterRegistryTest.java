package com.einvoicenews.collector.adapter;

import com.einvoicenews.collector.client.PageTransport;
import com.einvoicenews.collector.client.RateLimitedFetcherFactory;
import com.einvoicenews.collector.config.CollectorProperties;
import com.einvoicenews.collector.config.SourcesConfig;
import com.einvoicenews.collector.config.SourcesConfig.AdapterType;
import com.einvoicenews.collector.config.SourcesConfig.SourceDefinition;
import com.einvoicenews.collector.entity.SourceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class SourceAdapterRegistryTest {

    private final CollectorProperties properties = new CollectorProperties();
    private final RateLimitedFetcherFactory fetcherFactory =
            new RateLimitedFetcherFactory(mock(PageTransport.class), properties);

    private static SourceDefinition definition(String id, AdapterType type, boolean enabled) {
        SourceDefinition definition = new SourceDefinition();
        definition.setId(id);
        definition.setName(id.toUpperCase());
        definition.setKind(SourceKind.NEWS);
        definition.setType(type);
        definition.setEnabled(enabled);
        definition.setUrls(List.of("https://example.com/" + id));
        return definition;
    }

    @Test
    @DisplayName("builds one adapter per enabled source, by type")
    void buildsAdapters() {
        // given
        SourcesConfig config = new SourcesConfig();
        config.setSources(List.of(
                definition("listing", AdapterType.LISTING, true),
                definition("feed", AdapterType.RSS, true),
                definition("atlas", AdapterType.PAGE, true),
                definition("off", AdapterType.LISTING, false)));

        // when
        SourceAdapterRegistry registry = new SourceAdapterRegistry(config, fetcherFactory, properties, Clock.systemUTC());

        // then
        assertThat(registry.getAdapters()).extracting(SourceAdapter::sourceId).containsExactly("listing", "feed", "atlas");
        assertThat(registry.getAdapters().get(0)).isInstanceOf(ListingPageAdapter.class);
        assertThat(registry.getAdapters().get(1)).isInstanceOf(RssFeedAdapter.class);
        assertThat(registry.getAdapters().get(2)).isInstanceOf(CompliancePageAdapter.class);
    }

    @Test
    @DisplayName("source ids must be unique")
    void duplicateIds() {
        SourcesConfig config = new SourcesConfig();
        config.setSources(List.of(
                definition("same", AdapterType.LISTING, true),
                definition("same", AdapterType.RSS, true)));

        assertThatThrownBy(() -> new SourceAdapterRegistry(config, fetcherFactory, properties, Clock.systemUTC()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("same");
    }
}
