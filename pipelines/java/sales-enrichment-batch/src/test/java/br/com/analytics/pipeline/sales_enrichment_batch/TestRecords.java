package br.com.analytics.pipeline.sales_enrichment_batch;

import br.com.analytics.pipeline.sales_enrichment_batch.lookup.InMemoryKeyedLookup;
import br.com.analytics.pipeline.sales_enrichment_batch.model.CustomerRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.model.EnrichedRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.model.TransactionRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.partition.CalendarDates;

import java.math.BigDecimal;
import java.util.List;

public final class TestRecords {

    public static final CustomerRecord C1 = new CustomerRecord("C1", "26-35", "Gold", "2024-06-01");

    private TestRecords() {
    }

    public static TransactionRecord transaction(String id, String customerId, String amount, String timestamp) {
        return transaction(id, customerId, amount, timestamp, "North", "Laptop");
    }

    public static TransactionRecord transaction(String id, String customerId, String amount, String timestamp,
                                                String region, String product) {
        return new TransactionRecord(id, timestamp, customerId, product, 1, new BigDecimal(amount), region,
                new BigDecimal(amount));
    }

    public static EnrichedRecord enriched(String id, String customerId, String amount, String timestamp) {
        return EnrichedRecord.of(transaction(id, customerId, amount, timestamp),
                "C1".equals(customerId) ? C1 : null,
                CalendarDates.parse(timestamp).orElse(null));
    }

    public static EnrichedRecord enriched(String id, String amount, String timestamp, String region, String product) {
        return EnrichedRecord.of(transaction(id, null, amount, timestamp, region, product), null,
                CalendarDates.parse(timestamp).orElse(null));
    }

    /**
     * T1 (C1, 100, 2025-01-05), T2 (unknown C2, 50, 2025-01-20), T3 (C1, 75, 2025-02-01).
     */
    public static List<TransactionRecord> exampleTransactions() {
        return List.of(
                transaction("T1", "C1", "100", "2025-01-05 09:15:00.123456789"),
                transaction("T2", "C2", "50", "2025-01-20 18:00:00"),
                transaction("T3", "C1", "75", "2025-02-01T00:00:01Z"));
    }

    public static InMemoryKeyedLookup<String, CustomerRecord> exampleCustomers() {
        InMemoryKeyedLookup.Builder<String, CustomerRecord> builder =
                InMemoryKeyedLookup.builder(CustomerRecord::customerId);
        builder.add(C1);
        return builder.build();
    }
}
