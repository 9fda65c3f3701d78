package br.com.analytics.pipeline.sales_enrichment_batch.catalog;

public record ColumnDefinition(String name, String type) {
}
