package br.com.analytics.pipeline.sales_enrichment_batch.model;

import java.util.List;

/**
 * Counts of one run plus the first record errors it met.
 */
public record RunReport(
        long transactionsRead,
        long malformedTransactions,
        long customersLoaded,
        long malformedCustomers,
        long duplicateCustomers,
        long enrichedRecords,
        long unmatchedTransactions,
        long badTimestamps,
        long outputRecords,
        long summaryGroups,
        int partitionsWritten,
        int partitionsFailed,
        boolean summaryWritten,
        List<RecordError> errorSamples
) {

    public RunReport {
        errorSamples = List.copyOf(errorSamples);
    }

    public long inputRecords() {
        return transactionsRead + malformedTransactions;
    }

    public long recordErrors() {
        return malformedTransactions + malformedCustomers + badTimestamps;
    }

    public boolean hasFailedPartitions() {
        return partitionsFailed > 0;
    }

    public boolean isPartial() {
        return hasFailedPartitions() || !summaryWritten;
    }

    @Override
    public String toString() {
        return "input=" + inputRecords()
                + " output=" + outputRecords
                + " recordErrors=" + recordErrors()
                + " (malformedTransactions=" + malformedTransactions
                + ", malformedCustomers=" + malformedCustomers
                + ", badTimestamps=" + badTimestamps + ")"
                + " customersLoaded=" + customersLoaded
                + " duplicateCustomers=" + duplicateCustomers
                + " unmatched=" + unmatchedTransactions
                + " summaryGroups=" + summaryGroups
                + " partitionsWritten=" + partitionsWritten
                + " partitionsFailed=" + partitionsFailed
                + " summaryWritten=" + summaryWritten;
    }
}
