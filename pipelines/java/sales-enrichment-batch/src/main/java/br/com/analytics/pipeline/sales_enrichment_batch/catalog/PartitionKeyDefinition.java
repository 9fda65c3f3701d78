package br.com.analytics.pipeline.sales_enrichment_batch.catalog;

/**
 * Integer partition key with the inclusive range a query engine may project
 * partitions over without listing storage.
 */
public record PartitionKeyDefinition(String name, String type, int min, int max) {

    public PartitionKeyDefinition {
        if (min > max) {
            throw new IllegalArgumentException("Empty projection range for " + name + ": " + min + "," + max);
        }
    }

    public static PartitionKeyDefinition integer(String name, int min, int max) {
        return new PartitionKeyDefinition(name, "int", min, max);
    }

    public static PartitionKeyDefinition parse(String name, String type, String range) {
        String[] bounds = range.split(",");
        if (bounds.length != 2) {
            throw new IllegalArgumentException("Projection range must be 'min,max': " + range);
        }
        return new PartitionKeyDefinition(name, type, Integer.parseInt(bounds[0].strip()), Integer.parseInt(bounds[1].strip()));
    }

    public String range() {
        return min + "," + max;
    }
}
