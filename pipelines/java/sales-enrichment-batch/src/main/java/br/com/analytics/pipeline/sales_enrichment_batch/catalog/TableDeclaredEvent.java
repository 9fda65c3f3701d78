package br.com.analytics.pipeline.sales_enrichment_batch.catalog;

public record TableDeclaredEvent(TableDefinition table, String ddl) {
}
