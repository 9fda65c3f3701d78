package br.com.analytics.pipeline.sales_enrichment_batch.catalog;

import br.com.analytics.pipeline.sales_enrichment_batch.model.PartitionKey;
import br.com.analytics.pipeline.sales_enrichment_batch.writer.ParquetSchemas;

import java.nio.file.Path;
import java.time.Year;
import java.util.Collection;
import java.util.IntSummaryStatistics;
import java.util.List;

/**
 * Catalog declarations of the enriched and summary tables.
 */
public final class SalesTables {

    public static final String STORAGE_FORMAT = "PARQUET";
    public static final String COMPRESSION = "SNAPPY";

    private SalesTables() {
    }

    /**
     * The year projection spans the years of the given partitions; with none it
     * falls back to the current year.
     */
    public static TableDefinition enriched(String database, String table, Path location,
                                           Collection<PartitionKey> partitions) {
        IntSummaryStatistics years = partitions.stream().mapToInt(PartitionKey::year).summaryStatistics();
        int minYear = years.getCount() == 0 ? Year.now().getValue() : years.getMin();
        int maxYear = years.getCount() == 0 ? minYear : years.getMax();

        return new TableDefinition(
                database,
                table,
                normalize(location),
                STORAGE_FORMAT,
                COMPRESSION,
                CatalogColumns.fromAvro(ParquetSchemas.ENRICHED),
                List.of(
                        PartitionKeyDefinition.integer("year", minYear, maxYear),
                        PartitionKeyDefinition.integer("month", 1, 12)));
    }

    public static TableDefinition summary(String database, String table, Path location) {
        return new TableDefinition(
                database,
                table,
                normalize(location),
                STORAGE_FORMAT,
                COMPRESSION,
                CatalogColumns.fromAvro(ParquetSchemas.SUMMARY),
                List.of());
    }

    private static String normalize(Path location) {
        return location.toAbsolutePath().normalize().toString();
    }
}
