package com.einvoicenews.collector.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Source descriptor embedded in every item. The kind is stored under "type" in the corpus file.
 */
public record ItemSource(
        String id,
        String name,
        @JsonProperty("type") SourceKind kind
) {}
