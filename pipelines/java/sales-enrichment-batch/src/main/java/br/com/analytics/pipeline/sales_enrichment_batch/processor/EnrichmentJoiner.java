package br.com.analytics.pipeline.sales_enrichment_batch.processor;

import br.com.analytics.pipeline.sales_enrichment_batch.lookup.KeyedLookup;
import br.com.analytics.pipeline.sales_enrichment_batch.model.CustomerRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.model.EnrichedRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.model.TransactionRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.partition.CalendarDates;

/**
 * Left outer hash join of transactions against customer demographics. Every
 * transaction yields exactly one enriched record, matched or not.
 */
public class EnrichmentJoiner {

    private final KeyedLookup<String, CustomerRecord> customers;

    public EnrichmentJoiner(KeyedLookup<String, CustomerRecord> customers) {
        this.customers = customers;
    }

    public EnrichedRecord enrich(TransactionRecord transaction) {
        CustomerRecord customer = customers.find(transaction.customerId());
        return EnrichedRecord.of(transaction, customer, CalendarDates.parse(transaction.timestamp()).orElse(null));
    }

    public boolean matches(TransactionRecord transaction) {
        return customers.find(transaction.customerId()) != null;
    }
}
