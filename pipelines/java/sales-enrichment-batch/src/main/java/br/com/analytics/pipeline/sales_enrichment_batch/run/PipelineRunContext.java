package br.com.analytics.pipeline.sales_enrichment_batch.run;

import br.com.analytics.pipeline.sales_enrichment_batch.lookup.KeyedLookup;
import br.com.analytics.pipeline.sales_enrichment_batch.model.CustomerRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.model.PartitionWriteResult;
import br.com.analytics.pipeline.sales_enrichment_batch.model.RecordError;
import br.com.analytics.pipeline.sales_enrichment_batch.model.RunReport;
import br.com.analytics.pipeline.sales_enrichment_batch.partition.PartitionArena;
import br.com.analytics.pipeline.sales_enrichment_batch.processor.EnrichmentJoiner;
import br.com.analytics.pipeline.sales_enrichment_batch.processor.SalesAggregator;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State shared by the steps of one job execution. Reset before every run, so a
 * re-run never sees the buffers or counters of the previous one.
 */
@Component
public class PipelineRunContext {

    public static final String TRANSACTIONS_SOURCE = "transactions";
    public static final String CUSTOMERS_SOURCE = "customers";

    private final RecordErrorLog errors = new RecordErrorLog();
    private final PartitionArena arena = new PartitionArena();
    private final SalesAggregator aggregator = new SalesAggregator();
    private final List<PartitionWriteResult> partitionResults = new ArrayList<>();
    private final AtomicLong transactionsRead = new AtomicLong();
    private final AtomicLong unmatchedTransactions = new AtomicLong();
    private final AtomicLong enrichedRecords = new AtomicLong();

    private volatile String runId = "";
    private volatile @Nullable EnrichmentJoiner joiner;
    private volatile long customersLoaded;
    private volatile long duplicateCustomers;
    private volatile boolean summaryWritten;
    private volatile @Nullable RunReport lastReport;

    public synchronized void reset(String runId) {
        this.runId = runId;
        this.joiner = null;
        this.customersLoaded = 0;
        this.duplicateCustomers = 0;
        this.summaryWritten = false;
        this.transactionsRead.set(0);
        this.unmatchedTransactions.set(0);
        this.enrichedRecords.set(0);
        errors.clear();
        arena.clear();
        aggregator.clear();
        partitionResults.clear();
    }

    public void customersLoaded(KeyedLookup<String, CustomerRecord> customers, long duplicates) {
        this.customersLoaded = customers.size();
        this.duplicateCustomers = duplicates;
        this.joiner = new EnrichmentJoiner(customers);
    }

    public EnrichmentJoiner joiner() {
        EnrichmentJoiner current = joiner;
        if (current == null) {
            throw new IllegalStateException("Customer reference data has not been loaded for run " + runId);
        }
        return current;
    }

    public void transactionRead() {
        transactionsRead.incrementAndGet();
    }

    public void unmatchedTransaction() {
        unmatchedTransactions.incrementAndGet();
    }

    public void enrichedRecords(long count) {
        enrichedRecords.addAndGet(count);
    }

    public void summaryWritten(boolean written) {
        this.summaryWritten = written;
    }

    public boolean summaryWritten() {
        return summaryWritten;
    }

    public synchronized void partitionResults(List<PartitionWriteResult> results) {
        partitionResults.clear();
        partitionResults.addAll(results);
    }

    public synchronized List<PartitionWriteResult> partitionResults() {
        return List.copyOf(partitionResults);
    }

    public RecordErrorLog errors() {
        return errors;
    }

    public PartitionArena arena() {
        return arena;
    }

    public SalesAggregator aggregator() {
        return aggregator;
    }

    public String runId() {
        return runId;
    }

    public synchronized RunReport report() {
        long badTimestamps = errors.count(TRANSACTIONS_SOURCE, RecordError.Kind.BAD_TIMESTAMP);
        int written = (int) partitionResults.stream().filter(PartitionWriteResult::isWritten).count();
        RunReport report = new RunReport(
                transactionsRead.get(),
                errors.count(TRANSACTIONS_SOURCE, RecordError.Kind.MALFORMED),
                customersLoaded,
                errors.count(CUSTOMERS_SOURCE, RecordError.Kind.MALFORMED),
                duplicateCustomers,
                enrichedRecords.get(),
                unmatchedTransactions.get(),
                badTimestamps,
                arena.size(),
                aggregator.groupCount(),
                written,
                partitionResults.size() - written,
                summaryWritten,
                errors.samples()
        );
        this.lastReport = report;
        return report;
    }

    public @Nullable RunReport lastReport() {
        return lastReport;
    }
}
