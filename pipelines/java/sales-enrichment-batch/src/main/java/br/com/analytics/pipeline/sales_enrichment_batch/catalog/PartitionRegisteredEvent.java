package br.com.analytics.pipeline.sales_enrichment_batch.catalog;

public record PartitionRegisteredEvent(
        String database,
        String table,
        String partitionName,
        String location,
        long recordCount
) {
}
