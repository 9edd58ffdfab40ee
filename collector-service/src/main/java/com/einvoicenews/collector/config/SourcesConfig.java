package com.einvoicenews.collector.config;

import com.einvoicenews.collector.entity.SourceKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Registered sources. Each entry becomes one adapter with its own fetcher and rate limit.
 */
@Configuration
@ConfigurationProperties(prefix = "collector.data-sources")
@Validated
@Data
public class SourcesConfig {

    @Valid
    private List<SourceDefinition> sources = new ArrayList<>();

    public enum AdapterType {
        /** HTML listing pages scraped with CSS selectors */
        LISTING,
        /** RSS or Atom feeds */
        RSS,
        /** One item per configured page, each page tied to a country */
        PAGE
    }

    public enum Relevance {
        /** Built-in e-invoicing keyword list */
        EINVOICE,
        /** Configured keywords, or the e-invoicing list */
        KEYWORDS,
        /** Accept everything */
        NONE
    }

    @Data
    public static class SourceDefinition {

        @NotBlank
        private String id;

        @NotBlank
        private String name;

        @NotNull
        private SourceKind kind;

        private AdapterType type = AdapterType.LISTING;

        private boolean enabled = true;

        /** Default region for items of this source */
        private String region = "global";

        private String country;

        private String countryName;

        /** Listing pages or feed URLs, fetched in order */
        private List<String> urls = new ArrayList<>();

        /** Country pages for {@code type: page} */
        @Valid
        private List<PageTarget> pages = new ArrayList<>();

        /** Item container selectors; the first one that matches anything is used */
        private List<String> itemSelectors = new ArrayList<>(List.of(
                "article", ".news-item", ".post", "li[class*=news]", ".item"));

        private String titleSelector = "h2, h3, h4, .title, a[class*=title]";

        private String linkSelector = "a[href]";

        private String dateSelector = "time, .date, [class*=date], span[class*=time]";

        private String summarySelector = ".summary, .description, .excerpt, p";

        /** Items read per page or feed */
        @Min(1)
        private int maxItems = 20;

        @Min(1)
        private int minTitleLength = 10;

        private Relevance relevance = Relevance.EINVOICE;

        private List<String> keywords = new ArrayList<>();

        /** Derive country and region from item text instead of the source defaults */
        private boolean detectCountry = false;

        @AssertTrue(message = "a page source needs pages, other sources need urls")
        public boolean isTargetsConfigured() {
            return type == AdapterType.PAGE
                    ? pages != null && !pages.isEmpty()
                    : urls != null && !urls.isEmpty();
        }
    }

    @Data
    public static class PageTarget {

        @NotBlank
        private String url;

        @NotBlank
        private String country;

        @NotBlank
        private String countryName;

        private String region = "global";
    }
}
