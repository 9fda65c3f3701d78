package br.com.analytics.pipeline.sales_enrichment_batch.catalog;

import java.util.List;
import java.util.stream.Collectors;

public record TableDefinition(
        String database,
        String name,
        String location,
        String storageFormat,
        String compression,
        List<ColumnDefinition> columns,
        List<PartitionKeyDefinition> partitionKeys
) {

    public TableDefinition {
        columns = List.copyOf(columns);
        partitionKeys = List.copyOf(partitionKeys);
    }

    public boolean isPartitioned() {
        return !partitionKeys.isEmpty();
    }

    /**
     * Storage location of one partition with placeholders for each key, e.g.
     * {@code /data/enriched/year=${year}/month=${month}}.
     */
    public String locationTemplate() {
        return location + "/" + partitionKeys.stream()
                .map(key -> key.name() + "=${" + key.name() + "}")
                .collect(Collectors.joining("/"));
    }
}
