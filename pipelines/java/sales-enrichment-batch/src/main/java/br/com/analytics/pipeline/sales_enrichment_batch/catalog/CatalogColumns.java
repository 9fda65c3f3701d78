package br.com.analytics.pipeline.sales_enrichment_batch.catalog;

import org.apache.avro.Schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Catalog column list derived from the Avro schema the Parquet files are
 * written with, so the declared columns always match the files.
 */
public final class CatalogColumns {

    private CatalogColumns() {
    }

    public static List<ColumnDefinition> fromAvro(Schema schema) {
        List<ColumnDefinition> columns = new ArrayList<>();
        for (Schema.Field field : schema.getFields()) {
            columns.add(new ColumnDefinition(field.name(), hiveType(field.schema())));
        }
        return columns;
    }

    static String hiveType(Schema schema) {
        Schema actual = nonNull(schema);
        return switch (actual.getType()) {
            case STRING, ENUM -> "string";
            case INT -> "int";
            case LONG -> "bigint";
            case DOUBLE -> "double";
            case FLOAT -> "float";
            case BOOLEAN -> "boolean";
            case BYTES, FIXED -> "binary";
            default -> throw new IllegalArgumentException("No catalog type for Avro type " + actual.getType());
        };
    }

    private static Schema nonNull(Schema schema) {
        if (schema.getType() != Schema.Type.UNION) {
            return schema;
        }
        return schema.getTypes().stream()
                .filter(branch -> branch.getType() != Schema.Type.NULL)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Union without a non-null branch: " + schema));
    }
}
