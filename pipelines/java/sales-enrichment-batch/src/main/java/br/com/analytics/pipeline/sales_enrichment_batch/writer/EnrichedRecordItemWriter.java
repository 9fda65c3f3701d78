package br.com.analytics.pipeline.sales_enrichment_batch.writer;

import br.com.analytics.pipeline.sales_enrichment_batch.model.EnrichedRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.model.PartitionKey;
import br.com.analytics.pipeline.sales_enrichment_batch.model.RecordError;
import br.com.analytics.pipeline.sales_enrichment_batch.partition.TemporalPartitioner;
import br.com.analytics.pipeline.sales_enrichment_batch.run.PipelineRunContext;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;

import java.util.Optional;

/**
 * Routes each enriched record into its partition buffer and into the summary
 * aggregation. Records whose timestamp has no valid date are reported and go to
 * neither.
 */
public class EnrichedRecordItemWriter implements ItemWriter<EnrichedRecord> {

    private final PipelineRunContext runContext;

    public EnrichedRecordItemWriter(PipelineRunContext runContext) {
        this.runContext = runContext;
    }

    @Override
    public void write(Chunk<? extends EnrichedRecord> chunk) throws Exception {
        runContext.enrichedRecords(chunk.size());
        for (EnrichedRecord record : chunk) {
            Optional<PartitionKey> key = TemporalPartitioner.keyOf(record);
            if (key.isEmpty()) {
                runContext.errors().record(new RecordError(
                        PipelineRunContext.TRANSACTIONS_SOURCE,
                        0,
                        RecordError.Kind.BAD_TIMESTAMP,
                        "Transaction " + record.transactionId() + " has no valid date in '" + record.timestamp() + "'"));
                continue;
            }
            runContext.arena().append(key.get(), record);
            runContext.aggregator().accumulate(record);
        }
    }
}
