package br.com.analytics.pipeline.sales_enrichment_batch.processor;

import br.com.analytics.pipeline.sales_enrichment_batch.TestRecords;
import br.com.analytics.pipeline.sales_enrichment_batch.model.EnrichedRecord;
import br.com.analytics.pipeline.sales_enrichment_batch.model.TransactionRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static br.com.analytics.pipeline.sales_enrichment_batch.TestRecords.transaction;
import static org.assertj.core.api.Assertions.assertThat;

class EnrichmentJoinerTest {

    private final EnrichmentJoiner joiner = new EnrichmentJoiner(TestRecords.exampleCustomers());

    @Test
    void keepsEveryTransactionInOrder() {
        List<TransactionRecord> transactions = TestRecords.exampleTransactions();

        List<EnrichedRecord> enriched = transactions.stream().map(joiner::enrich).toList();

        assertThat(enriched).hasSameSizeAs(transactions);
        assertThat(enriched).extracting(EnrichedRecord::transactionId).containsExactly("T1", "T2", "T3");
    }

    @Test
    void matchedTransactionCarriesCustomerDemographics() {
        EnrichedRecord t1 = joiner.enrich(transaction("T1", "C1", "100", "2025-01-05 09:15:00"));

        assertThat(t1.ageGroup()).isEqualTo("26-35");
        assertThat(t1.membershipTier()).isEqualTo("Gold");
        assertThat(t1.signupDate()).isEqualTo("2024-06-01");
        assertThat(t1.year()).isEqualTo(2025);
        assertThat(t1.month()).isEqualTo(1);
        assertThat(t1.day()).isEqualTo(5);
        assertThat(t1.timestamp()).isEqualTo("2025-01-05 09:15:00");
    }

    @Test
    void unmatchedTransactionKeepsNullCustomerFields() {
        TransactionRecord t2 = transaction("T2", "C2", "50", "2025-01-20");

        EnrichedRecord enriched = joiner.enrich(t2);

        assertThat(joiner.matches(t2)).isFalse();
        assertThat(enriched.customerId()).isEqualTo("C2");
        assertThat(enriched.ageGroup()).isNull();
        assertThat(enriched.membershipTier()).isNull();
        assertThat(enriched.signupDate()).isNull();
        assertThat(enriched.totalAmount()).isEqualByComparingTo("50");
    }

    @Test
    void transactionWithoutCustomerIdIsKept() {
        EnrichedRecord enriched = joiner.enrich(transaction("T9", null, "5", "2025-03-01"));

        assertThat(enriched.customerId()).isNull();
        assertThat(enriched.ageGroup()).isNull();
        assertThat(enriched.hasCalendarDate()).isTrue();
    }

    @Test
    void invalidDateLeavesDerivedFieldsEmpty() {
        EnrichedRecord enriched = joiner.enrich(transaction("T4", "C1", "20", "2025-02-30 10:00:00"));

        assertThat(enriched.ageGroup()).isEqualTo("26-35");
        assertThat(enriched.hasCalendarDate()).isFalse();
        assertThat(enriched.year()).isNull();
        assertThat(enriched.day()).isNull();
    }
}
