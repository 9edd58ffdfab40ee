package com.einvoicenews.collector.adapter;

import com.einvoicenews.collector.entity.Item;
import com.einvoicenews.collector.entity.SourceKind;

import java.util.List;

/**
 * A pluggable producer of items for one named source.
 * <p>
 * Implementations may throw; the orchestrator records the failure and carries on with
 * the remaining sources.
 */
public interface SourceAdapter {

    String sourceId();

    String sourceName();

    SourceKind sourceKind();

    List<Item> produceItems() throws Exception;
}
