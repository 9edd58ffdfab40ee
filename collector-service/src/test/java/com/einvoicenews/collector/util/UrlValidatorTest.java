package com.einvoicenews.collector.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class UrlValidatorTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "https://zatca.gov.sa/en/MediaCenter/News/Pages/news_1.aspx",
            "http://example.com",
            "HTTPS://Example.COM/path?q=1",
            "https://sub_domain.example.com/x",
            "  https://example.com/padded  ",
            "https://example.com/hotel:dubai",
            "https://example.com/events/mailto:press",
            "https://example.com/void(0)"
    })
    @DisplayName("accepts absolute http(s) URLs with a dotted host")
    void acceptsValidUrls(String url) {
        assertThat(UrlValidator.isValid(url)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "javascript:void(0)",
            "JavaScript:alert(1)",
            "mailto:info@example.com",
            "tel:+971800",
            "#section",
            "/relative/path",
            "ftp://example.com/file",
            "https://localhost/admin",
            "https://.example.com",
            "not a url"
    })
    @DisplayName("rejects script, mail, phone, fragment, relative and host-less links")
    void rejectsInvalidUrls(String url) {
        assertThat(UrlValidator.isValid(url)).isFalse();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    @DisplayName("rejects null and blank")
    void rejectsBlank(String url) {
        assertThat(UrlValidator.isValid(url)).isFalse();
    }

    @Test
    @DisplayName("host with a port is accepted")
    void hostWithPort() {
        assertThat(UrlValidator.isValid("https://example.com:8443/news")).isTrue();
    }
}
