package com.einvoicenews.collector.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of sources an item can come from.
 *
 * - OFFICIAL: tax authorities and government portals
 * - ADVISORY: consulting and audit firms
 * - VENDOR: e-invoicing software vendors
 * - NEWS: regional business press
 * - AGGREGATOR: VAT / e-invoicing news aggregators
 * - SOCIAL: social network company pages
 */
public enum SourceKind {
    OFFICIAL("official"),
    ADVISORY("advisory"),
    VENDOR("vendor"),
    NEWS("news"),
    AGGREGATOR("aggregator"),
    SOCIAL("social");

    private final String value;

    SourceKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SourceKind fromValue(String value) {
        for (SourceKind kind : SourceKind.values()) {
            if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown source kind: " + value);
    }
}
