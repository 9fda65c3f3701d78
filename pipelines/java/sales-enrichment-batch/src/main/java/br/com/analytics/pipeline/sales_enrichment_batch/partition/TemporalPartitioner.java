package br.com.analytics.pipeline.sales_enrichment_batch.partition;

import br.com.analytics.pipeline.sales_enrichment_batch.model.EnrichedRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.model.PartitionKey;

import java.util.Optional;

public final class TemporalPartitioner {

    private TemporalPartitioner() {
    }

    public static Optional<PartitionKey> keyOf(EnrichedRecord record) {
        if (!record.hasCalendarDate()) {
            return Optional.empty();
        }
        return Optional.of(new PartitionKey(record.year(), record.month()));
    }
}
