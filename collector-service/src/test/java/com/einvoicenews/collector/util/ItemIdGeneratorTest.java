package com.einvoicenews.collector.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ItemIdGeneratorTest {

    @Test
    @DisplayName("source id, UTC day and the first 8 hex characters of the URL hash")
    void formatsWithDate() {
        // when
        String id = ItemIdGenerator.generate("zatca", "https://zatca.gov.sa/news/1",
                Instant.parse("2025-03-14T23:30:00Z"));

        // then
        assertThat(id).isEqualTo("zatca-2025-03-14-cbe0f3e1");
    }

    @Test
    @DisplayName("the day is taken in UTC")
    void usesUtcDay() {
        String id = ItemIdGenerator.generate("ey", "https://example.com/a", Instant.parse("2025-03-15T00:30:00Z"));

        assertThat(id).isEqualTo("ey-2025-03-15-cd69b81e");
    }

    @Test
    @DisplayName("without a date the day part is left out")
    void formatsWithoutDate() {
        assertThat(ItemIdGenerator.generate("ey", "https://example.com/a", null)).isEqualTo("ey-cd69b81e");
    }

    @Test
    @DisplayName("URL case and surrounding whitespace do not change the id")
    void normalizesUrl() {
        Instant day = Instant.parse("2025-01-01T00:00:00Z");

        assertThat(ItemIdGenerator.generate("s", "  HTTPS://EXAMPLE.COM/A ", day))
                .isEqualTo(ItemIdGenerator.generate("s", "https://example.com/a", day));
    }
}
