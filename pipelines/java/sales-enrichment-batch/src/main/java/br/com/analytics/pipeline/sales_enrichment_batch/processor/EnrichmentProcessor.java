package br.com.analytics.pipeline.sales_enrichment_batch.processor;

import br.com.analytics.pipeline.sales_enrichment_batch.model.EnrichedRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.model.TransactionRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.run.PipelineRunContext;
import org.springframework.batch.infrastructure.item.ItemProcessor;

/**
 * Joins each transaction with the customer lookup loaded earlier in the run.
 * Never filters: the left join keeps every transaction.
 */
public class EnrichmentProcessor implements ItemProcessor<TransactionRecord, EnrichedRecord> {

    private final PipelineRunContext runContext;

    public EnrichmentProcessor(PipelineRunContext runContext) {
        this.runContext = runContext;
    }

    @Override
    public EnrichedRecord process(TransactionRecord item) throws Exception {
        EnrichmentJoiner joiner = runContext.joiner();
        runContext.transactionRead();

        EnrichedRecord enriched = joiner.enrich(item);
        if (!joiner.matches(item)) {
            runContext.unmatchedTransaction();
        }
        return enriched;
    }
}
