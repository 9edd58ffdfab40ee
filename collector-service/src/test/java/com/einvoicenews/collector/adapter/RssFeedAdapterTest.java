package com.einvoicenews.collector.adapter;

import com.einvoicenews.collector.client.PageTransport;
import com.einvoicenews.collector.client.RateLimitedFetcher;
import com.einvoicenews.collector.client.SlidingWindowRateLimiter;
import com.einvoicenews.collector.config.SourcesConfig.AdapterType;
import com.einvoicenews.collector.config.SourcesConfig.Relevance;
import com.einvoicenews.collector.config.SourcesConfig.SourceDefinition;
import com.einvoicenews.collector.entity.Item;
import com.einvoicenews.collector.entity.SourceKind;
import com.einvoicenews.collector.exception.SourceAdapterException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RssFeedAdapterTest {

    private static final String FEED_URL = "https://sovos.com/feed/";

    @Mock
    private PageTransport transport;

    private final Clock clock = Clock.fixed(Instant.parse("2025-06-15T12:00:00Z"), ZoneOffset.UTC);

    private SourceDefinition definition;

    @BeforeEach
    void setUp() {
        definition = new SourceDefinition();
        definition.setId("sovos");
        definition.setName("Sovos");
        definition.setKind(SourceKind.VENDOR);
        definition.setType(AdapterType.RSS);
        definition.setDetectCountry(true);
        definition.setRelevance(Relevance.EINVOICE);
        definition.setUrls(List.of(FEED_URL));
    }

    private RssFeedAdapter adapter() {
        RateLimitedFetcher fetcher = new RateLimitedFetcher("sovos", transport,
                new SlidingWindowRateLimiter(10, Duration.ofSeconds(60)), Duration.ofSeconds(5));
        return new RssFeedAdapter(definition, fetcher, new ItemFactory(definition, clock, 300));
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = RssFeedAdapterTest.class.getResourceAsStream("/fixtures/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    @DisplayName("relevant entries with a link become items")
    void readsFeed() throws IOException {
        // given
        when(transport.get(eq(FEED_URL), any())).thenReturn(fixture("sovos-feed.xml"));

        // when
        List<Item> items = adapter().produceItems();

        // then
        assertThat(items).hasSize(1);
        Item item = items.get(0);
        assertThat(item.getTitle()).isEqualTo("Belgium confirms B2B e-invoicing mandate for 2026");
        assertThat(item.getUrl()).isEqualTo("https://sovos.com/blog/belgium-b2b-mandate/");
        assertThat(item.getSummary()).isEqualTo("Belgian Peppol e-invoicing becomes mandatory.");
        assertThat(item.getPublishedAt()).isEqualTo(Instant.parse("2025-03-14T10:00:00Z"));
        assertThat(item.getCountry()).isEqualTo("BE");
        assertThat(item.getSource().kind()).isEqualTo(SourceKind.VENDOR);
        assertThat(item.getCategories()).contains("mandate");
    }

    @Test
    @DisplayName("without relevance filtering every linked entry is kept")
    void noRelevance() throws IOException {
        definition.setRelevance(Relevance.NONE);
        when(transport.get(eq(FEED_URL), any())).thenReturn(fixture("sovos-feed.xml"));

        assertThat(adapter().produceItems()).hasSize(2);
    }

    @Test
    @DisplayName("a document that is not a feed fails the adapter")
    void invalidFeed() {
        when(transport.get(eq(FEED_URL), any())).thenReturn("<html><body>Maintenance</body></html>");

        assertThatThrownBy(() -> adapter().produceItems()).isInstanceOf(SourceAdapterException.class);
    }
}
