package br.com.analytics.pipeline.sales_enrichment_batch.model;

import java.util.Comparator;

public record AggregationKey(
        String region,
        String product,
        int year,
        int month
) implements Comparable<AggregationKey> {

    private static final Comparator<AggregationKey> ORDER = Comparator
            .comparingInt(AggregationKey::year)
            .thenComparingInt(AggregationKey::month)
            .thenComparing(AggregationKey::region)
            .thenComparing(AggregationKey::product);

    @Override
    public int compareTo(AggregationKey other) {
        return ORDER.compare(this, other);
    }
}
