package br.com.analytics.pipeline.sales_enrichment_batch.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A transaction joined with its customer demographics. Customer fields are null
 * when the transaction had no matching customer; year, month and day are null
 * when the timestamp carries no valid calendar date.
 */
public record EnrichedRecord(
        String transactionId,
        String timestamp,
        @Nullable String customerId,
        String product,
        Integer quantity,
        BigDecimal unitPrice,
        String region,
        BigDecimal totalAmount,
        @Nullable String ageGroup,
        @Nullable String membershipTier,
        @Nullable String signupDate,
        @Nullable Integer year,
        @Nullable Integer month,
        @Nullable Integer day
) {

    public static EnrichedRecord of(TransactionRecord transaction,
                                    @Nullable CustomerRecord customer,
                                    @Nullable LocalDate date) {
        return new EnrichedRecord(
                transaction.transactionId(),
                transaction.timestamp(),
                transaction.customerId(),
                transaction.product(),
                transaction.quantity(),
                transaction.unitPrice(),
                transaction.region(),
                transaction.totalAmount(),
                customer == null ? null : customer.ageGroup(),
                customer == null ? null : customer.membershipTier(),
                customer == null ? null : customer.signupDate(),
                date == null ? null : date.getYear(),
                date == null ? null : date.getMonthValue(),
                date == null ? null : date.getDayOfMonth()
        );
    }

    public boolean hasCalendarDate() {
        return year != null && month != null && day != null;
    }
}
