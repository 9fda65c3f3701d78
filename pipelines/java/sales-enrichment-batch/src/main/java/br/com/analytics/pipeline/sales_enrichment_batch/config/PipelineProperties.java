package br.com.analytics.pipeline.sales_enrichment_batch.config;

import br.com.analytics.pipeline.sales_enrichment_batch.writer.WriteMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "pipeline")
public record PipelineProperties(
        @DefaultValue Input input,
        @DefaultValue Output output,
        @DefaultValue Writer writer,
        @DefaultValue Catalog catalog,
        @DefaultValue("500") int chunkSize,
        @DefaultValue("true") boolean runOnStartup
) {

    public record Input(
            @DefaultValue("data/raw/sales_data.csv") String transactions,
            @DefaultValue("data/raw/customer_demographics.json") String customers
    ) {

        public Path transactionsPath() {
            return Path.of(transactions);
        }

        public Path customersPath() {
            return Path.of(customers);
        }
    }

    public record Output(
            @DefaultValue("data/processed") String basePath,
            @DefaultValue("OVERWRITE") WriteMode writeMode
    ) {

        public Path enrichedPath() {
            return Path.of(basePath).resolve("enriched");
        }

        public Path summaryPath() {
            return Path.of(basePath).resolve("summary");
        }
    }

    public record Writer(
            @DefaultValue("4") int threads
    ) {
    }

    public record Catalog(
            @DefaultValue("sales_analytics_db") String database,
            @DefaultValue("enriched_sales") String enrichedTable,
            @DefaultValue("sales_summary") String summaryTable
    ) {
    }
}
