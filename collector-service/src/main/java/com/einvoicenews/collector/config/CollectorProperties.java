package com.einvoicenews.collector.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engine settings: worker pool, corpus bound, duplicate threshold, per-source quota and HTTP.
 */
@Configuration
@ConfigurationProperties(prefix = "collector")
@Validated
@Data
public class CollectorProperties {

    /**
     * Run one collection when the application starts, then exit
     */
    private boolean runOnStartup = true;

    /**
     * Number of adapters executed in parallel
     */
    @Min(1)
    private int concurrency = 5;

    /**
     * Maximum number of items kept in the corpus
     */
    @Min(1)
    private int maxItems = 500;

    /**
     * Title similarity ratio at or above which two items are duplicates
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.85;

    /**
     * Summaries are cut to this many characters on a word boundary
     */
    @Min(20)
    private int summaryMaxLength = 300;

    @Valid
    private Store store = new Store();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Http http = new Http();

    @Data
    public static class Store {
        /** Corpus file location */
        @NotBlank
        private String path = "data/news.json";
    }

    @Data
    public static class RateLimit {
        /** Calls allowed per window, per source */
        @Min(1)
        private int calls = 10;

        /** Rolling window length */
        @NotNull
        private Duration window = Duration.ofSeconds(60);
    }

    @Data
    public static class Http {
        /** Per-fetch timeout */
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        /** TCP connect timeout */
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);

        /** Largest response body buffered in memory, in bytes */
        @Min(1024)
        private int maxBodyBytes = 5 * 1024 * 1024;

        /** Headers sent with every page request */
        private Map<String, String> headers = defaultHeaders();

        private static Map<String, String> defaultHeaders() {
            Map<String, String> headers = new LinkedHashMap<>();
            headers.put("User-Agent",
                    "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36");
            headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8");
            headers.put("Accept-Language", "en-US,en;q=0.5");
            return headers;
        }
    }
}
