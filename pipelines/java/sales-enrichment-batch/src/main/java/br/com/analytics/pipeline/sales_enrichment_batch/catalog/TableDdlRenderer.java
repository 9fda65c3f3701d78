package br.com.analytics.pipeline.sales_enrichment_batch.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a table declaration as an external-table DDL statement for a
 * Hive-compatible query engine. Partitioned tables get partition projection
 * properties so partitions are found without listing storage.
 */
public final class TableDdlRenderer {

    private TableDdlRenderer() {
    }

    public static String render(TableDefinition table) {
        StringBuilder ddl = new StringBuilder();
        ddl.append("CREATE EXTERNAL TABLE IF NOT EXISTS ")
                .append(table.database()).append('.').append(table.name()).append(" (\n");
        appendColumns(ddl, table.columns().stream()
                .map(column -> column.name() + " " + column.type().toUpperCase(Locale.ROOT))
                .toList());
        ddl.append(")\n");

        if (table.isPartitioned()) {
            ddl.append("PARTITIONED BY (\n");
            appendColumns(ddl, table.partitionKeys().stream()
                    .map(key -> key.name() + " " + key.type().toUpperCase(Locale.ROOT))
                    .toList());
            ddl.append(")\n");
        }

        ddl.append("STORED AS ").append(table.storageFormat()).append('\n')
                .append("LOCATION '").append(table.location()).append("'\n")
                .append("TBLPROPERTIES (\n");

        List<String> properties = new ArrayList<>();
        properties.add(property("parquet.compress", table.compression()));
        if (table.isPartitioned()) {
            properties.add(property("projection.enabled", "true"));
            for (PartitionKeyDefinition key : table.partitionKeys()) {
                properties.add(property("projection." + key.name() + ".type", "integer"));
                properties.add(property("projection." + key.name() + ".range", key.range()));
            }
            properties.add(property("storage.location.template", table.locationTemplate()));
        }
        appendColumns(ddl, properties);
        ddl.append(");");
        return ddl.toString();
    }

    private static void appendColumns(StringBuilder ddl, List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            ddl.append("    ").append(lines.get(i));
            if (i < lines.size() - 1) {
                ddl.append(',');
            }
            ddl.append('\n');
        }
    }

    private static String property(String key, String value) {
        return "'" + key + "' = '" + value + "'";
    }
}
