package br.com.analytics.pipeline.sales_enrichment_batch.model;

import java.util.Comparator;

/**
 * Calendar (year, month) key of an enriched partition. Renders as the
 * hive-style directory {@code year=<Y>/month=<M>}, month not zero padded.
 */
public record PartitionKey(int year, int month) implements Comparable<PartitionKey> {

    private static final Comparator<PartitionKey> ORDER = Comparator
            .comparingInt(PartitionKey::year)
            .thenComparingInt(PartitionKey::month);

    public PartitionKey {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month out of range: " + month);
        }
    }

    public String path() {
        return "year=" + year + "/month=" + month;
    }

    @Override
    public int compareTo(PartitionKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return path();
    }
}
