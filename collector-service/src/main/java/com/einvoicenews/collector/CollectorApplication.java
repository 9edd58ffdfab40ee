package com.einvoicenews.collector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * E-Invoice News Collector
 *
 * Batch collector for e-invoicing and tax-compliance news
 * - Listing pages and RSS feeds from tax authorities, advisory firms, vendors and news sites
 * - Sources collected in parallel, each under its own request quota
 * - Duplicate-free, bounded corpus kept in a JSON file for the static front end
 */
@SpringBootApplication
public class CollectorApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CollectorApplication.class, args)));
    }
}
