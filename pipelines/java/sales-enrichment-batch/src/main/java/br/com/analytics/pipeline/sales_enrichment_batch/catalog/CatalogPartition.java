package br.com.analytics.pipeline.sales_enrichment_batch.catalog;

import java.time.Instant;

public record CatalogPartition(
        String database,
        String table,
        String partitionName,
        String location,
        long recordCount,
        Instant registeredAt
) {
}
