package br.com.analytics.pipeline.sales_enrichment_batch.lookup;

import org.jspecify.annotations.Nullable;

/**
 * Read-only reference data keyed by identifier. Implementations must be safe
 * for concurrent readers once published.
 */
public interface KeyedLookup<K, V> {

    @Nullable V find(@Nullable K key);

    int size();
}
